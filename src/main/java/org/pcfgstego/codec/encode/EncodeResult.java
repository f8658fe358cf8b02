package org.pcfgstego.codec.encode;

import java.util.List;

/**
 * The outcome of an encode call.
 *
 * @param text The generated carrier sentence.
 * @param payload The bits the encoder tried to embed.
 * @param bitsEmbedded How many leading bits of {@code payload} the sentence actually carries.
 * @param attempts The number of derivations performed, at least 1.
 * @param accepted {@code false} if every attempt failed the naturalness check and the last one was kept.
 * @param choices The expansion decisions of the returned sentence, in derivation order.
 */
public record EncodeResult(
        String text,
        String payload,
        int bitsEmbedded,
        int attempts,
        boolean accepted,
        List<Choice> choices
) {
    public EncodeResult {
        choices = List.copyOf(choices);
    }

    /**
     * @return The prefix of the payload that is carried by {@link #text()}.
     */
    public String embeddedBits() {
        return payload.substring(0, bitsEmbedded);
    }
}
