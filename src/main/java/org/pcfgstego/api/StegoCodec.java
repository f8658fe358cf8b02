package org.pcfgstego.api;

import org.pcfgstego.codec.detect.DetectionResult;
import org.pcfgstego.codec.detect.Detector;
import org.pcfgstego.codec.encode.EncodeResult;
import org.pcfgstego.codec.encode.Encoder;
import org.pcfgstego.codec.huffman.CodeTable;
import org.pcfgstego.codec.huffman.HuffmanCodeBuilder;
import org.pcfgstego.codec.naturalness.INaturalnessEvaluator;
import org.pcfgstego.codec.search.KeyCandidate;
import org.pcfgstego.codec.search.KeySearchEngine;
import org.pcfgstego.config.CodecSettings;
import org.pcfgstego.grammar.Grammar;
import org.pcfgstego.grammar.GrammarLoader;
import org.pcfgstego.grammar.GrammarParser;
import org.pcfgstego.grammar.api.GrammarException;
import org.pcfgstego.internal.services.SeededRandomProvider;
import org.pcfgstego.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The codec for one grammar: owns the grammar, its code-table cache and the configured components.
 * <p>
 * Encoding uses a single random provider and is therefore not thread-safe; detection, capacity and
 * code tables only read immutable or append-only state.
 */
public final class StegoCodec implements IStegoCodec {

    private static final Logger LOG = LoggerFactory.getLogger(StegoCodec.class);

    private final Grammar grammar;
    private final CodecSettings settings;
    private final HuffmanCodeBuilder codes;
    private final Encoder encoder;
    private final Detector detector;
    private final KeySearchEngine keySearch;

    public StegoCodec(Grammar grammar, CodecSettings settings, INaturalnessEvaluator naturalness, IRandomProvider random) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codes = new HuffmanCodeBuilder(grammar);
        this.encoder = new Encoder(codes, naturalness, random, settings.encoder().maxAttempts());
        CodecSettings.DetectorSettings detectorSettings = settings.detector();
        this.detector = new Detector(codes, naturalness, detectorSettings.markers(),
                detectorSettings.excludedSymbols(), detectorSettings.slotSymbols());
        this.keySearch = settings.search().createEngine();
    }

    /**
     * Creates a codec with the configured naturalness evaluator and random seed.
     *
     * @param grammar A parsed grammar.
     * @param settings The codec settings.
     * @return The codec.
     */
    public static StegoCodec create(Grammar grammar, CodecSettings settings) {
        IRandomProvider random = settings.encoder().seed().isPresent()
                ? new SeededRandomProvider(settings.encoder().seed().getAsLong())
                : SeededRandomProvider.fromEntropy();
        return new StegoCodec(grammar, settings, settings.naturalness().createEvaluator(), random);
    }

    /**
     * Loads a grammar file with the configured parser and creates a codec for it.
     *
     * @param grammarFile The grammar file.
     * @param settings The codec settings.
     * @return The codec.
     * @throws GrammarException if the file is missing or does not parse.
     */
    public static StegoCodec fromFile(Path grammarFile, CodecSettings settings) throws GrammarException {
        return fromFile(grammarFile, settings, false);
    }

    /**
     * Loads a grammar file and creates a codec for it. A lenient load clamps out-of-range probabilities
     * with a warning even when {@code grammar.strict} is set.
     *
     * @throws GrammarException if the file is missing or does not parse.
     */
    public static StegoCodec fromFile(Path grammarFile, CodecSettings settings, boolean lenient) throws GrammarException {
        GrammarParser parser = lenient ? settings.grammar().createLenientParser() : settings.grammar().createParser();
        return create(new GrammarLoader(parser).load(grammarFile), settings);
    }

    @Override
    public EncodeResult encode(String message, String key) {
        return encode(message, key, settings.encoder().payloadBits(), settings.encoder().maxBits());
    }

    @Override
    public EncodeResult encode(String message, String key, int bits, int maxBits) {
        EncodeResult result = encoder.encode(message, key, bits, maxBits);
        if (result.bitsEmbedded() < result.payload().length()) {
            LOG.info("Grammar capacity reached: embedded {} of {} bits", result.bitsEmbedded(), result.payload().length());
        }
        return result;
    }

    @Override
    public DetectionReport detect(String text, DetectOptions options) {
        DetectionResult detection = options.slotSymbols().isEmpty()
                ? detector.detect(text)
                : detector.detect(text, options.slotSymbols());
        if (!detection.detected() || options.keys().isEmpty()) {
            return new DetectionReport(detection, List.of());
        }
        List<KeyCandidate> ranked = keySearch.recover(text, detection.bits(), options.keys(), options.messages());
        return new DetectionReport(detection, ranked);
    }

    @Override
    public CapacityReport capacity() {
        String staticSymbol = settings.grammar().staticSymbol();
        Map<String, Integer> perSymbol = new LinkedHashMap<>();
        int total = 0;
        for (String symbol : grammar.symbols()) {
            int k = grammar.alternatives(symbol).size();
            if (k < 2 || symbol.equals(staticSymbol)) {
                continue;
            }
            int bits = 31 - Integer.numberOfLeadingZeros(k);
            perSymbol.put(symbol, bits);
            total += bits;
        }
        return new CapacityReport(total, perSymbol);
    }

    @Override
    public CodeTable codeTable(String symbol) {
        return codes.codeTable(symbol);
    }

    @Override
    public Grammar grammar() {
        return grammar;
    }

    public CodecSettings settings() {
        return settings;
    }
}
