package org.pcfgstego.codec.encode;

/**
 * One expansion decision made during a derivation.
 *
 * @param symbol The expanded symbol.
 * @param alternative The declared text of the chosen alternative.
 * @param codeword The payload bits the choice consumed; empty when it consumed none.
 */
public record Choice(String symbol, String alternative, String codeword) {

    /**
     * @return {@code true} if the choice was dictated by payload bits.
     */
    public boolean consumedBits() {
        return !codeword.isEmpty();
    }
}
