package org.pcfgstego.grammar;

import org.pcfgstego.grammar.diagnostics.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable weighted context-free grammar.
 * <p>
 * Symbols keep their declaration order and every symbol's alternatives keep theirs, so everything
 * derived from a grammar (code tables, slot lists) is reproducible across runs. Instances are only
 * produced by {@link GrammarParser} and are safe to share between threads.
 */
public final class Grammar {

    private final String startSymbol;
    private final Map<String, List<Alternative>> rules;
    private final List<Diagnostic> warnings;

    Grammar(String startSymbol, Map<String, List<Alternative>> rules, List<Diagnostic> warnings) {
        this.startSymbol = startSymbol;
        LinkedHashMap<String, List<Alternative>> copy = new LinkedHashMap<>();
        rules.forEach((symbol, alternatives) -> copy.put(symbol, List.copyOf(alternatives)));
        this.rules = Collections.unmodifiableMap(copy);
        this.warnings = List.copyOf(warnings);
    }

    public String startSymbol() {
        return startSymbol;
    }

    /**
     * @return All symbols with a rule, in declaration order.
     */
    public Set<String> symbols() {
        return rules.keySet();
    }

    /**
     * Returns the alternatives of a symbol in declaration order.
     *
     * @param symbol A symbol with a rule.
     * @return The alternatives, never empty.
     * @throws IllegalArgumentException if the symbol has no rule.
     */
    public List<Alternative> alternatives(String symbol) {
        List<Alternative> alternatives = rules.get(symbol);
        if (alternatives == null) {
            throw new IllegalArgumentException("No rule for symbol: " + symbol);
        }
        return alternatives;
    }

    /**
     * A token is a terminal when it is a quoted literal or when no rule is declared for it.
     *
     * @param token A raw token from an alternative.
     * @return {@code true} if the token is emitted as-is.
     */
    public boolean isTerminal(String token) {
        return Tokens.isQuoted(token) || !rules.containsKey(token);
    }

    /**
     * @param symbol A symbol with a rule.
     * @return {@code true} if the symbol has exactly one alternative and so carries no choice.
     */
    public boolean isDeterministic(String symbol) {
        return alternatives(symbol).size() == 1;
    }

    /**
     * @param alternative An alternative of this grammar.
     * @return {@code true} if the alternative contains no symbol that would be expanded further.
     */
    public boolean isTerminalOnly(Alternative alternative) {
        return alternative.tokens().stream().allMatch(this::isTerminal);
    }

    /**
     * @return The warnings the parser emitted while building this grammar.
     */
    public List<Diagnostic> warnings() {
        return warnings;
    }
}
