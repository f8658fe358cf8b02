package org.pcfgstego.grammar;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One right-hand side of a rule together with its normalized weight.
 *
 * @param text The alternative exactly as declared, used as its identity in code tables.
 * @param tokens The raw tokens of {@code text}, quotes preserved.
 * @param weight The probability of choosing this alternative, in [0, 1].
 */
public record Alternative(String text, List<String> tokens, double weight) {

    public Alternative {
        tokens = List.copyOf(tokens);
    }

    /**
     * @return The tokens' surface forms joined by single spaces.
     */
    public String surfaceText() {
        return tokens.stream().map(Tokens::surface).collect(Collectors.joining(" "));
    }
}
