package org.pcfgstego.codec.encode;

import org.pcfgstego.codec.huffman.CodeTable;
import org.pcfgstego.codec.huffman.HuffmanCodeBuilder;
import org.pcfgstego.codec.naturalness.INaturalnessEvaluator;
import org.pcfgstego.codec.payload.PayloadDeriver;
import org.pcfgstego.grammar.Alternative;
import org.pcfgstego.grammar.Grammar;
import org.pcfgstego.grammar.Tokens;
import org.pcfgstego.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Generates a carrier sentence that hides a bit payload in its grammar choices.
 * <p>
 * A derivation expands the leftmost pending symbol first. When a symbol with several alternatives is
 * expanded for the first time in an attempt and payload bits remain, the first alternative (in
 * declaration order) whose codeword equals the next payload bits is chosen and those bits are
 * consumed. Every other choice is a weighted random pick that consumes nothing, so each symbol
 * carries at most one codeword per sentence.
 * <p>
 * A finished sentence must pass the naturalness check. Failing attempts are repeated with the same
 * payload and fresh randomness up to {@code maxAttempts}; after that the last sentence is returned
 * anyway. Not thread-safe because the random provider is not.
 */
public final class Encoder {

    private static final Logger LOG = LoggerFactory.getLogger(Encoder.class);

    /** Attempt ceiling used when none is configured. */
    public static final int DEFAULT_MAX_ATTEMPTS = 15;

    /** Expansions after which a derivation is treated as non-terminating. */
    static final int MAX_EXPANSIONS = 10_000;

    private static final String TERMINAL_PUNCTUATION = ".?!:";

    private final Grammar grammar;
    private final HuffmanCodeBuilder codes;
    private final INaturalnessEvaluator naturalness;
    private final IRandomProvider random;
    private final int maxAttempts;

    public Encoder(HuffmanCodeBuilder codes, INaturalnessEvaluator naturalness, IRandomProvider random, int maxAttempts) {
        this.codes = Objects.requireNonNull(codes, "codes");
        this.grammar = codes.grammar();
        this.naturalness = Objects.requireNonNull(naturalness, "naturalness");
        this.random = Objects.requireNonNull(random, "random");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Derives the payload for a message and key and embeds it.
     *
     * @param message The secret message.
     * @param key The key.
     * @param bits The payload length.
     * @param maxBits Upper bound on the embedded prefix, or 0 for none.
     * @return The generated sentence and how much of the payload it carries.
     */
    public EncodeResult encode(String message, String key, int bits, int maxBits) {
        String payload = PayloadDeriver.derive(message, key, bits);
        if (maxBits > 0 && payload.length() > maxBits) {
            payload = payload.substring(0, maxBits);
        }
        return encode(payload);
    }

    /**
     * Embeds an explicit bit string.
     *
     * @param payload A string over {@code '0'} and {@code '1'}.
     * @return The generated sentence and how much of the payload it carries.
     */
    public EncodeResult encode(String payload) {
        Objects.requireNonNull(payload, "payload");
        if (!payload.chars().allMatch(c -> c == '0' || c == '1')) {
            throw new IllegalArgumentException("Payload must contain only '0' and '1'");
        }

        DerivationState last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            DerivationState state = derive(payload);
            String text = render(state.words());
            if (naturalness.isNatural(text)) {
                state.transition(DerivationState.Phase.ACCEPTED);
                LOG.debug("Attempt {} accepted, embedded {}/{} bits", attempt, state.cursor(), payload.length());
                return new EncodeResult(text, payload, state.cursor(), attempt, true, state.choices());
            }
            state.transition(DerivationState.Phase.RETRY);
            LOG.debug("Attempt {} failed the naturalness check: {}", attempt, text);
            last = state;
        }

        String text = render(last.words());
        LOG.warn("No natural sentence after {} attempts, returning the last candidate", maxAttempts);
        return new EncodeResult(text, payload, last.cursor(), maxAttempts, false, last.choices());
    }

    private DerivationState derive(String payload) {
        DerivationState state = new DerivationState(grammar.startSymbol(), payload);
        int expansions = 0;
        while (state.hasPending()) {
            String token = state.popPending();
            if (grammar.isTerminal(token)) {
                String word = Tokens.surface(token);
                if (!word.isEmpty()) {
                    state.emit(word);
                }
                continue;
            }
            if (++expansions > MAX_EXPANSIONS) {
                throw new IllegalStateException("Derivation exceeded " + MAX_EXPANSIONS
                        + " expansions; the grammar does not terminate from " + grammar.startSymbol());
            }
            Alternative chosen = choose(token, state);
            state.pushFront(chosen.tokens());
        }
        state.transition(DerivationState.Phase.TERMINAL_COLLECTION);
        return state;
    }

    private Alternative choose(String symbol, DerivationState state) {
        List<Alternative> alternatives = grammar.alternatives(symbol);
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        CodeTable table = codes.codeTable(symbol);
        if (!state.payloadExhausted() && !state.isUsed(symbol)) {
            for (int i = 0; i < table.size(); i++) {
                String codeword = table.codeword(i);
                if (state.payloadMatches(codeword)) {
                    state.consume(symbol, codeword);
                    Alternative alternative = table.alternatives().get(i);
                    state.record(new Choice(symbol, alternative.text(), codeword));
                    return alternative;
                }
            }
            // A random slot here would put foreign bits in front of the remaining payload.
            state.haltPayload();
        }
        Alternative alternative = weightedChoice(alternatives);
        state.record(new Choice(symbol, alternative.text(), ""));
        return alternative;
    }

    private Alternative weightedChoice(List<Alternative> alternatives) {
        double r = random.nextDouble();
        double cumulative = 0.0;
        for (Alternative alternative : alternatives) {
            cumulative += alternative.weight();
            if (r < cumulative) {
                return alternative;
            }
        }
        return alternatives.get(alternatives.size() - 1);
    }

    static String render(List<String> words) {
        String text = String.join(" ", words).strip();
        if (text.isEmpty() || TERMINAL_PUNCTUATION.indexOf(text.charAt(text.length() - 1)) < 0) {
            text = text + ".";
        }
        return text;
    }
}
