package org.pcfgstego.codec.payload;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Derives the fixed-length bit payload for a (message, key) pair.
 * <p>
 * The SHA-256 digest of {@code message + key} (UTF-8) is read as an unsigned integer and written in
 * binary without leading zeros. That string is left-padded with zeros to {@code bits} characters
 * when shorter, and its first {@code bits} characters are the payload.
 */
public final class PayloadDeriver {

    /** Payload length used when the caller does not ask for one. */
    public static final int DEFAULT_BITS = 96;

    private static final String ALGORITHM = "SHA-256";

    private PayloadDeriver() {}

    /**
     * @param message The secret message.
     * @param key The key.
     * @param bits The payload length, at least 0.
     * @return A string of exactly {@code bits} characters over {@code '0'} and {@code '1'}.
     */
    public static String derive(String message, String key, int bits) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(key, "key");
        return hashBits(message + key, bits);
    }

    /**
     * Same as {@link #derive(String, String, int)} for a single input string.
     *
     * @param input The hashed text.
     * @param bits The result length, at least 0.
     * @return A string of exactly {@code bits} binary digits.
     */
    public static String hashBits(String input, int bits) {
        if (bits < 0) {
            throw new IllegalArgumentException("bits must be >= 0, was " + bits);
        }
        String binary = new BigInteger(1, sha256(input)).toString(2);
        if (binary.length() < bits) {
            binary = "0".repeat(bits - binary.length()) + binary;
        }
        return binary.substring(0, bits);
    }

    /**
     * @return The fraction of positions at which two equal-length bit strings agree, 0 when empty.
     */
    public static double similarity(String a, String b) {
        if (a.length() != b.length()) {
            throw new IllegalArgumentException("Bit strings differ in length: " + a.length() + " vs " + b.length());
        }
        if (a.isEmpty()) {
            return 0.0;
        }
        int same = 0;
        for (int i = 0; i < a.length(); i++) {
            if (a.charAt(i) == b.charAt(i)) same++;
        }
        return (double) same / a.length();
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
