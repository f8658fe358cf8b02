package org.pcfgstego.api;

import org.pcfgstego.codec.encode.EncodeResult;
import org.pcfgstego.codec.huffman.CodeTable;
import org.pcfgstego.grammar.Grammar;

/**
 * Hides key-derived payloads in generated sentences and reads them back, for one grammar.
 */
public interface IStegoCodec {

    /**
     * Encodes with the configured payload length and bit cap.
     *
     * @param message The secret message.
     * @param key The key.
     * @return The carrier sentence and the number of embedded bits.
     */
    EncodeResult encode(String message, String key);

    /**
     * @param message The secret message.
     * @param key The key.
     * @param bits The payload length.
     * @param maxBits Cap on embedded bits, 0 for none.
     * @return The carrier sentence and the number of embedded bits.
     */
    EncodeResult encode(String message, String key, int bits, int maxBits);

    /**
     * Locates the carrier sentence, rebuilds the bits and, if keys are given, ranks them.
     *
     * @param text The text to analyse.
     * @param options Keys, messages and slot override.
     * @return The detection report; detection failure is reported, not thrown.
     */
    DetectionReport detect(String text, DetectOptions options);

    /**
     * @return The theoretical capacity of the grammar.
     */
    CapacityReport capacity();

    /**
     * @param symbol A symbol of the grammar.
     * @return Its prefix code.
     */
    CodeTable codeTable(String symbol);

    Grammar grammar();
}
