package org.pcfgstego.codec.naturalness;

/**
 * Judges how much a text looks like ordinary English.
 */
public interface INaturalnessEvaluator {

    /**
     * The acceptance test the encoder retries against.
     *
     * @param text A generated sentence.
     * @return {@code true} if the text is accepted as natural.
     */
    boolean isNatural(String text);

    /**
     * A continuous score for diagnostics.
     *
     * @param text Any text.
     * @return A value in [0, 1]; higher is more natural.
     */
    double naturality(String text);
}
