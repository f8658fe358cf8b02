package org.pcfgstego.codec.naturalness;

/**
 * Relative frequencies of the letters a-z in English prose.
 */
public final class EnglishLetterFrequencies {

    private static final double[] FREQUENCIES = {
            0.08167, 0.01492, 0.02782, 0.04253, 0.12702, 0.02228, 0.02015, // a-g
            0.06094, 0.06966, 0.00153, 0.00772, 0.04025, 0.02406, 0.06749, // h-n
            0.07507, 0.01929, 0.00095, 0.05987, 0.06327, 0.09056, 0.02758, // o-u
            0.00978, 0.02360, 0.00150, 0.01974, 0.00074                    // v-z
    };

    private EnglishLetterFrequencies() {}

    /**
     * @param letter A lowercase ASCII letter.
     * @return Its expected relative frequency.
     */
    public static double of(char letter) {
        if (letter < 'a' || letter > 'z') {
            throw new IllegalArgumentException("Not a lowercase ASCII letter: " + letter);
        }
        return FREQUENCIES[letter - 'a'];
    }

    /**
     * @return A copy of the table indexed by {@code letter - 'a'}.
     */
    public static double[] table() {
        return FREQUENCIES.clone();
    }
}
