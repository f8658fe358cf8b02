package org.pcfgstego.codec.search;

/**
 * A ranked guess produced by {@link KeySearchEngine}.
 *
 * @param key The candidate key.
 * @param message The message whose payload matched, or {@code null} for a key-only match.
 * @param confidence The fraction of agreeing bits, in [0, 1].
 */
public record KeyCandidate(String key, String message, double confidence) {

    /** Note reported instead of a message when only the key itself resembled the bits. */
    public static final String POSSIBLE_KEY = "possible key";

    /**
     * @return {@code true} if a concrete message was matched.
     */
    public boolean hasMessage() {
        return message != null;
    }

    /**
     * @return The matched message, or {@link #POSSIBLE_KEY}.
     */
    public String messageOrNote() {
        return message != null ? message : POSSIBLE_KEY;
    }
}
