package org.pcfgstego.codec.naturalness;

import java.util.Objects;

/**
 * Compares a text's letter distribution with {@link EnglishLetterFrequencies}.
 * <p>
 * Every alphabetic code point counts towards the sample size, but only the ASCII letters a-z and A-Z
 * land in the histogram, case-folded. Other letters therefore count as deviation from English. Texts
 * with fewer than {@code minLetters} letters are too small to judge and are always natural (score 1.0).
 * <p>
 * {@link #isNatural(String)} fails as soon as one key letter's observed frequency is further than
 * {@code maxRelativeDeviation * expected} from its expected frequency. {@link #naturality(String)}
 * averages the absolute deviation over all 26 letters and maps it to
 * {@code 1 - min(avg / calibration, 1)}.
 */
public final class LetterFrequencyEvaluator implements INaturalnessEvaluator {

    public static final int DEFAULT_MIN_LETTERS = 20;
    public static final double DEFAULT_MAX_RELATIVE_DEVIATION = 0.5;
    public static final double DEFAULT_CALIBRATION = 0.05;
    public static final String DEFAULT_HIGH_FREQUENCY_LETTERS = "etaoins";
    public static final String DEFAULT_LOW_FREQUENCY_LETTERS = "zqx";

    private static final double[] REFERENCE = EnglishLetterFrequencies.table();

    private final int minLetters;
    private final double maxRelativeDeviation;
    private final double calibration;
    private final char[] keyLetters;

    public LetterFrequencyEvaluator(int minLetters, double maxRelativeDeviation, double calibration, String keyLetters) {
        if (calibration <= 0) {
            throw new IllegalArgumentException("calibration must be > 0");
        }
        if (maxRelativeDeviation < 0) {
            throw new IllegalArgumentException("maxRelativeDeviation must be >= 0");
        }
        this.minLetters = minLetters;
        this.maxRelativeDeviation = maxRelativeDeviation;
        this.calibration = calibration;
        this.keyLetters = Objects.requireNonNull(keyLetters, "keyLetters").toLowerCase().toCharArray();
        for (char c : this.keyLetters) {
            EnglishLetterFrequencies.of(c);
        }
    }

    /**
     * @return An evaluator with the default thresholds and key letters.
     */
    public static LetterFrequencyEvaluator defaults() {
        return new LetterFrequencyEvaluator(DEFAULT_MIN_LETTERS, DEFAULT_MAX_RELATIVE_DEVIATION, DEFAULT_CALIBRATION,
                DEFAULT_HIGH_FREQUENCY_LETTERS + DEFAULT_LOW_FREQUENCY_LETTERS);
    }

    @Override
    public boolean isNatural(String text) {
        int[] counts = new int[26];
        int total = histogram(text, counts);
        if (total < minLetters) {
            return true;
        }
        for (char letter : keyLetters) {
            double expected = REFERENCE[letter - 'a'];
            double observed = (double) counts[letter - 'a'] / total;
            if (Math.abs(observed - expected) > maxRelativeDeviation * expected) {
                return false;
            }
        }
        return true;
    }

    @Override
    public double naturality(String text) {
        int[] counts = new int[26];
        int total = histogram(text, counts);
        if (total < minLetters) {
            return 1.0;
        }
        double deviation = 0.0;
        for (int i = 0; i < 26; i++) {
            deviation += Math.abs((double) counts[i] / total - REFERENCE[i]);
        }
        double average = deviation / 26;
        return 1.0 - Math.min(average / calibration, 1.0);
    }

    private static int histogram(String text, int[] counts) {
        int total = 0;
        for (int i = 0; i < text.length(); ) {
            int c = text.codePointAt(i);
            i += Character.charCount(c);
            if (!Character.isLetter(c)) {
                continue;
            }
            total++;
            if (c >= 'A' && c <= 'Z') {
                counts[c - 'A']++;
            } else if (c >= 'a' && c <= 'z') {
                counts[c - 'a']++;
            }
        }
        return total;
    }
}
