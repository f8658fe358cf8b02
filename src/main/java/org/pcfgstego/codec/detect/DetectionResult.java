package org.pcfgstego.codec.detect;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of a detection call.
 *
 * @param detected {@code true} if a carrier sentence was found and at least one slot matched.
 * @param bits The reconstructed bit string, the concatenated codewords of {@code matches}.
 * @param matches The matched slots in slot order.
 * @param carrierSentence The sentence the bits were read from, or {@code null} if none was found.
 * @param naturality The naturality score of the carrier sentence, 0 if none was found.
 */
public record DetectionResult(
        boolean detected,
        String bits,
        List<SlotMatch> matches,
        String carrierSentence,
        double naturality
) {
    public DetectionResult {
        matches = List.copyOf(matches);
    }

    /**
     * @return The result for a text without a carrier sentence.
     */
    public static DetectionResult notDetected() {
        return new DetectionResult(false, "", List.of(), null, 0.0);
    }

    public Optional<String> carrier() {
        return Optional.ofNullable(carrierSentence);
    }
}
