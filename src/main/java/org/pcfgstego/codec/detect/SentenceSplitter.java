package org.pcfgstego.codec.detect;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into sentences ending in {@code .}, {@code !} or {@code ?}, keeping their offsets.
 */
final class SentenceSplitter {

    private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]*");

    private SentenceSplitter() {}

    /**
     * A sentence and its position in the original text.
     *
     * @param text The sentence with surrounding whitespace removed.
     * @param start Offset of the first character of {@code text} in the original text.
     */
    record Sentence(String text, int start) {}

    static List<Sentence> split(String text) {
        List<Sentence> sentences = new ArrayList<>();
        Matcher m = SENTENCE.matcher(text);
        while (m.find()) {
            String raw = m.group();
            String stripped = raw.strip();
            if (stripped.isEmpty() || stripped.chars().noneMatch(Character::isLetterOrDigit)) {
                continue;
            }
            int leading = raw.indexOf(stripped);
            sentences.add(new Sentence(stripped, m.start() + leading));
        }
        return sentences;
    }
}
