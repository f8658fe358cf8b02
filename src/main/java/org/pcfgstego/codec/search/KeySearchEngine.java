package org.pcfgstego.codec.search;

import org.pcfgstego.codec.payload.PayloadDeriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks candidate keys and messages by how closely their derived payload resembles extracted bits.
 * <p>
 * For each key the candidate messages are tried in order and the first whose payload agrees with the
 * bits on more than {@code messageThreshold} of the positions is reported. A key with no such
 * message is compared against the leading {@code keyPrefixBits} bits of the hash of the key alone
 * and reported as a possible key above {@code keyThreshold}. This is a nearest-match heuristic: a
 * reported confidence is a similarity, not a proof.
 */
public final class KeySearchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(KeySearchEngine.class);

    public static final double DEFAULT_MESSAGE_THRESHOLD = 0.8;
    public static final double DEFAULT_KEY_THRESHOLD = 0.5;
    public static final int DEFAULT_KEY_PREFIX_BITS = 16;
    public static final List<String> DEFAULT_MESSAGES = List.of(
            "hello", "hi", "secret", "test", "message", "password", "attack at dawn", "meet me");

    private final double messageThreshold;
    private final double keyThreshold;
    private final int keyPrefixBits;
    private final List<String> defaultMessages;

    public KeySearchEngine(double messageThreshold, double keyThreshold, int keyPrefixBits, List<String> defaultMessages) {
        if (keyPrefixBits < 1) {
            throw new IllegalArgumentException("keyPrefixBits must be >= 1");
        }
        this.messageThreshold = messageThreshold;
        this.keyThreshold = keyThreshold;
        this.keyPrefixBits = keyPrefixBits;
        this.defaultMessages = List.copyOf(defaultMessages);
    }

    /**
     * @return An engine with the default thresholds and built-in messages.
     */
    public static KeySearchEngine defaults() {
        return new KeySearchEngine(DEFAULT_MESSAGE_THRESHOLD, DEFAULT_KEY_THRESHOLD, DEFAULT_KEY_PREFIX_BITS, DEFAULT_MESSAGES);
    }

    /**
     * Ranks the candidate keys.
     *
     * @param text The analysed text, for diagnostics only.
     * @param bits The bits extracted from the text.
     * @param keys The candidate keys, in priority order.
     * @param messages Candidate messages; {@code null} or empty uses the built-in set.
     * @return Matching candidates by descending confidence; equal confidences keep key order.
     */
    public List<KeyCandidate> recover(String text, String bits, List<String> keys, List<String> messages) {
        Objects.requireNonNull(bits, "bits");
        Objects.requireNonNull(keys, "keys");
        List<String> candidates = messages == null || messages.isEmpty() ? defaultMessages : messages;
        if (bits.isEmpty()) {
            LOG.debug("No bits to match, skipping key search");
            return List.of();
        }
        LOG.debug("Searching {} keys x {} messages against {} bits from a {}-character text",
                keys.size(), candidates.size(), bits.length(), text == null ? 0 : text.length());

        List<KeyCandidate> ranked = new ArrayList<>();
        for (String key : keys) {
            try {
                KeyCandidate candidate = evaluate(key, bits, candidates);
                if (candidate != null) {
                    ranked.add(candidate);
                }
            } catch (RuntimeException e) {
                LOG.warn("Skipping key candidate '{}': {}", key, e.getMessage());
            }
        }
        ranked.sort(Comparator.comparingDouble(KeyCandidate::confidence).reversed());
        return ranked;
    }

    private KeyCandidate evaluate(String key, String bits, List<String> messages) {
        Objects.requireNonNull(key, "key");
        for (String message : messages) {
            double similarity = PayloadDeriver.similarity(bits, PayloadDeriver.derive(message, key, bits.length()));
            if (similarity > messageThreshold) {
                return new KeyCandidate(key, message, similarity);
            }
        }
        int n = Math.min(bits.length(), keyPrefixBits);
        String keyBits = PayloadDeriver.hashBits(key, keyPrefixBits).substring(0, n);
        double similarity = PayloadDeriver.similarity(bits.substring(0, n), keyBits);
        return similarity > keyThreshold ? new KeyCandidate(key, null, similarity) : null;
    }
}
