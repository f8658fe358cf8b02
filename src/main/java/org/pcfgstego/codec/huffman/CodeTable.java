package org.pcfgstego.codec.huffman;

import org.pcfgstego.grammar.Alternative;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The prefix code of one symbol: a bijection between its alternatives and binary codewords.
 * <p>
 * Codewords are strings over {@code '0'} and {@code '1'}. A symbol with a single alternative has one
 * entry with the empty codeword. Entries keep the symbol's declaration order.
 */
public final class CodeTable {

    private final String symbol;
    private final List<Alternative> alternatives;
    private final List<String> codewords;
    private final Map<String, String> byAlternative;

    CodeTable(String symbol, List<Alternative> alternatives, List<String> codewords) {
        if (alternatives.size() != codewords.size()) {
            throw new IllegalArgumentException("Alternative and codeword counts differ for " + symbol);
        }
        this.symbol = symbol;
        this.alternatives = List.copyOf(alternatives);
        this.codewords = List.copyOf(codewords);
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < alternatives.size(); i++) {
            map.putIfAbsent(alternatives.get(i).text(), codewords.get(i));
        }
        this.byAlternative = Collections.unmodifiableMap(map);
    }

    public String symbol() {
        return symbol;
    }

    public int size() {
        return alternatives.size();
    }

    public List<Alternative> alternatives() {
        return alternatives;
    }

    /**
     * @param index Position of the alternative in declaration order.
     * @return The codeword of that alternative.
     */
    public String codeword(int index) {
        return codewords.get(index);
    }

    /**
     * @param alternativeText The declared text of an alternative.
     * @return Its codeword, or empty if the symbol has no such alternative.
     */
    public Optional<String> codewordFor(String alternativeText) {
        return Optional.ofNullable(byAlternative.get(alternativeText));
    }

    /**
     * @param codeword A complete codeword.
     * @return The alternative it encodes, or empty if it is not a codeword of this table.
     */
    public Optional<Alternative> alternativeFor(String codeword) {
        int index = codewords.indexOf(codeword);
        return index < 0 ? Optional.empty() : Optional.of(alternatives.get(index));
    }

    /**
     * @return Alternative text to codeword, in declaration order.
     */
    public Map<String, String> asMap() {
        return byAlternative;
    }

    /**
     * @return The probability-weighted mean codeword length.
     */
    public double expectedLength() {
        double total = 0.0;
        for (int i = 0; i < alternatives.size(); i++) {
            total += alternatives.get(i).weight() * codewords.get(i).length();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeTable other)) return false;
        return symbol.equals(other.symbol) && alternatives.equals(other.alternatives) && codewords.equals(other.codewords);
    }

    @Override
    public int hashCode() {
        return 31 * symbol.hashCode() + codewords.hashCode();
    }

    @Override
    public String toString() {
        return "CodeTable{" + symbol + "=" + byAlternative + "}";
    }
}
