package org.pcfgstego.codec.detect;

import org.pcfgstego.codec.huffman.CodeTable;
import org.pcfgstego.codec.huffman.HuffmanCodeBuilder;
import org.pcfgstego.codec.naturalness.INaturalnessEvaluator;
import org.pcfgstego.grammar.Alternative;
import org.pcfgstego.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the hidden bits back out of a carrier text.
 * <p>
 * The carrier is the first sentence containing one of the marker words, or the first sentence when
 * no markers are configured. For every slot symbol, in slot order, the alternatives of that symbol
 * are searched in declaration order and the first one found in the carrier (whole words,
 * case-insensitive) contributes its codeword. Slots without a match are skipped.
 * <p>
 * Only alternatives made entirely of terminals can be found, since nothing else appears verbatim in
 * the text. A word shared by alternatives of two slot symbols is attributed to whichever slot comes
 * first; slot order is the only disambiguation.
 */
public final class Detector {

    private static final Logger LOG = LoggerFactory.getLogger(Detector.class);

    private final Grammar grammar;
    private final HuffmanCodeBuilder codes;
    private final INaturalnessEvaluator naturalness;
    private final List<String> markers;
    private final Set<String> excludedSymbols;
    private final List<String> slotSymbols;

    /**
     * @param codes The code tables of the grammar the carrier was generated from.
     * @param naturalness Scores the carrier sentence for the result.
     * @param markers Words identifying the carrier sentence; empty selects the first sentence.
     * @param excludedSymbols Symbols that never carry payload, besides the start symbol.
     * @param slotSymbols Default slot order; empty means every payload symbol in declaration order.
     */
    public Detector(HuffmanCodeBuilder codes, INaturalnessEvaluator naturalness, List<String> markers,
                    Set<String> excludedSymbols, List<String> slotSymbols) {
        this.codes = Objects.requireNonNull(codes, "codes");
        this.grammar = codes.grammar();
        this.naturalness = Objects.requireNonNull(naturalness, "naturalness");
        this.markers = List.copyOf(markers);
        Set<String> excluded = new LinkedHashSet<>(excludedSymbols);
        excluded.add(grammar.startSymbol());
        this.excludedSymbols = Set.copyOf(excluded);
        this.slotSymbols = List.copyOf(slotSymbols);
    }

    /**
     * Detects with the configured slot order.
     *
     * @param text The text to analyse.
     * @return The detection result, never {@code null}.
     */
    public DetectionResult detect(String text) {
        return detect(text, slotSymbols);
    }

    /**
     * Detects with an explicit slot order.
     *
     * @param text The text to analyse.
     * @param slots The slot symbols in payload order; empty falls back to the default order.
     * @return The detection result, never {@code null}.
     */
    public DetectionResult detect(String text, List<String> slots) {
        Objects.requireNonNull(text, "text");
        Optional<SentenceSplitter.Sentence> carrier = findCarrier(text);
        if (carrier.isEmpty()) {
            LOG.debug("No carrier sentence found");
            return DetectionResult.notDetected();
        }
        SentenceSplitter.Sentence sentence = carrier.get();

        Map<String, CodeTable> tables = codes.codeTables(excludedSymbols);
        List<String> order = slots.isEmpty() ? List.copyOf(tables.keySet()) : slots;

        StringBuilder bits = new StringBuilder();
        List<SlotMatch> matches = new ArrayList<>();
        for (String slot : order) {
            CodeTable table = tables.get(slot);
            if (table == null) {
                LOG.warn("Slot symbol '{}' has no code table in this grammar, skipping", slot);
                continue;
            }
            Optional<SlotMatch> match = matchSlot(table, sentence);
            if (match.isPresent()) {
                matches.add(match.get());
                bits.append(match.get().codeword());
            } else {
                LOG.warn("No alternative of slot '{}' found in the carrier sentence", slot);
            }
        }

        double score = naturalness.naturality(sentence.text());
        return new DetectionResult(bits.length() > 0, bits.toString(), matches, sentence.text(), score);
    }

    private Optional<SentenceSplitter.Sentence> findCarrier(String text) {
        List<SentenceSplitter.Sentence> sentences = SentenceSplitter.split(text);
        if (markers.isEmpty()) {
            return sentences.stream().findFirst();
        }
        for (SentenceSplitter.Sentence sentence : sentences) {
            for (String marker : markers) {
                if (wholeWord(marker).matcher(sentence.text()).find()) {
                    return Optional.of(sentence);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<SlotMatch> matchSlot(CodeTable table, SentenceSplitter.Sentence sentence) {
        for (int i = 0; i < table.size(); i++) {
            Alternative alternative = table.alternatives().get(i);
            if (!grammar.isTerminalOnly(alternative)) {
                continue;
            }
            String surface = alternative.surfaceText();
            if (surface.isEmpty()) {
                continue;
            }
            Matcher m = wholeWord(surface).matcher(sentence.text());
            if (m.find()) {
                return Optional.of(new SlotMatch(table.symbol(), alternative.text(), table.codeword(i),
                        sentence.start() + m.start(), sentence.start() + m.end()));
            }
        }
        return Optional.empty();
    }

    private static Pattern wholeWord(String phrase) {
        return Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
