package org.pcfgstego.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.pcfgstego.codec.naturalness.LetterFrequencyEvaluator;
import org.pcfgstego.codec.search.KeySearchEngine;
import org.pcfgstego.grammar.GrammarParser;

import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Immutable view of the {@code pcfg-stego} configuration tree.
 * <p>
 * Values missing from the given configuration fall back to {@code reference.conf}.
 */
public record CodecSettings(
        GrammarSettings grammar,
        EncoderSettings encoder,
        NaturalnessSettings naturalness,
        DetectorSettings detector,
        SearchSettings search
) {
    /** Root path of all codec settings. */
    public static final String ROOT = "pcfg-stego";

    /**
     * @param startSymbol The symbol every derivation starts from.
     * @param staticSymbol Pseudo-symbol excluded from the capacity report.
     * @param weightTolerance Maximum distance of a weight sum from 1 before renormalization.
     * @param strict Whether out-of-range probabilities fail the parse.
     */
    public record GrammarSettings(String startSymbol, String staticSymbol, double weightTolerance, boolean strict) {
        public GrammarParser createParser() {
            return new GrammarParser(startSymbol, weightTolerance, strict);
        }

        /**
         * @return A parser with the same settings that clamps out-of-range probabilities regardless of {@code strict}.
         */
        public GrammarParser createLenientParser() {
            return new GrammarParser(startSymbol, weightTolerance, false);
        }
    }

    /**
     * @param payloadBits Default payload length.
     * @param maxBits Cap on embedded bits, 0 for none.
     * @param maxAttempts Naturalness retries before the last candidate is kept.
     * @param seed Seed for the fallback choices; empty seeds from system entropy.
     */
    public record EncoderSettings(int payloadBits, int maxBits, int maxAttempts, OptionalLong seed) {}

    public record NaturalnessSettings(int minLetters, double maxRelativeDeviation, double calibration,
                                      String highFrequencyLetters, String lowFrequencyLetters) {
        public LetterFrequencyEvaluator createEvaluator() {
            return new LetterFrequencyEvaluator(minLetters, maxRelativeDeviation, calibration,
                    highFrequencyLetters + lowFrequencyLetters);
        }
    }

    /**
     * @param markers Words identifying the carrier sentence.
     * @param slotSymbols Slot order; empty for declaration order.
     * @param excludedSymbols Symbols never read as slots.
     */
    public record DetectorSettings(List<String> markers, List<String> slotSymbols, Set<String> excludedSymbols) {
        public DetectorSettings {
            markers = List.copyOf(markers);
            slotSymbols = List.copyOf(slotSymbols);
            excludedSymbols = Set.copyOf(excludedSymbols);
        }
    }

    public record SearchSettings(double messageThreshold, double keyThreshold, int keyPrefixBits,
                                 List<String> defaultMessages) {
        public SearchSettings {
            defaultMessages = List.copyOf(defaultMessages);
        }

        public KeySearchEngine createEngine() {
            return new KeySearchEngine(messageThreshold, keyThreshold, keyPrefixBits, defaultMessages);
        }
    }

    /**
     * @return The settings defined by {@code reference.conf} alone.
     */
    public static CodecSettings defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Maps a configuration tree to settings.
     *
     * @param config A configuration containing (part of) the {@code pcfg-stego} tree.
     * @return The resolved settings.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static CodecSettings fromConfig(Config config) {
        Config c = config.withFallback(ConfigFactory.parseResources("reference.conf")).resolve().getConfig(ROOT);

        Config g = c.getConfig("grammar");
        GrammarSettings grammar = new GrammarSettings(
                g.getString("start-symbol"),
                g.getString("static-symbol"),
                g.getDouble("weight-tolerance"),
                g.getBoolean("strict"));

        Config e = c.getConfig("encoder");
        EncoderSettings encoder = new EncoderSettings(
                e.getInt("payload-bits"),
                e.getInt("max-bits"),
                e.getInt("max-attempts"),
                e.hasPath("seed") ? OptionalLong.of(e.getLong("seed")) : OptionalLong.empty());

        Config n = c.getConfig("naturalness");
        NaturalnessSettings naturalness = new NaturalnessSettings(
                n.getInt("min-letters"),
                n.getDouble("max-relative-deviation"),
                n.getDouble("calibration"),
                n.getString("high-frequency-letters"),
                n.getString("low-frequency-letters"));

        Config d = c.getConfig("detector");
        DetectorSettings detector = new DetectorSettings(
                d.getStringList("markers"),
                d.getStringList("slot-symbols"),
                Set.copyOf(d.getStringList("excluded-symbols")));

        Config s = c.getConfig("search");
        SearchSettings search = new SearchSettings(
                s.getDouble("message-threshold"),
                s.getDouble("key-threshold"),
                s.getInt("key-prefix-bits"),
                s.getStringList("default-messages"));

        return new CodecSettings(grammar, encoder, naturalness, detector, search);
    }
}
