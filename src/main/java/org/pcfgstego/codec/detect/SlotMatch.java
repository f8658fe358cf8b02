package org.pcfgstego.codec.detect;

/**
 * One slot recovered from the carrier sentence.
 *
 * @param symbol The slot symbol.
 * @param alternative The declared text of the alternative found in the sentence.
 * @param codeword The codeword of that alternative.
 * @param start Offset of the match in the analysed text, inclusive.
 * @param end Offset of the match in the analysed text, exclusive.
 */
public record SlotMatch(String symbol, String alternative, String codeword, int start, int end) {}
