package org.pcfgstego.codec.encode;

import org.pcfgstego.codec.huffman.HuffmanCodeBuilder;
import org.pcfgstego.codec.naturalness.INaturalnessEvaluator;
import org.pcfgstego.codec.payload.PayloadDeriver;
import org.pcfgstego.grammar.GrammarParser;
import org.pcfgstego.internal.services.SeededRandomProvider;
import org.pcfgstego.junit.extensions.logging.ExpectLog;
import org.pcfgstego.junit.extensions.logging.LogLevel;
import org.pcfgstego.junit.extensions.logging.LogWatchExtension;
import org.pcfgstego.spi.IRandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class EncoderTest {

    @Mock
    private IRandomProvider random;

    @Mock
    private INaturalnessEvaluator naturalness;

    private HuffmanCodeBuilder story;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/grammars/story.grammar")) {
            story = new HuffmanCodeBuilder(GrammarParser.strict().parse(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
        }
        lenient().when(naturalness.isNatural(anyString())).thenReturn(true);
    }

    private Encoder encoder(HuffmanCodeBuilder codes) {
        return new Encoder(codes, naturalness, random, Encoder.DEFAULT_MAX_ATTEMPTS);
    }

    @Test
    void payloadDictatesEveryChoiceWhileBitsRemain() {
        EncodeResult result = encoder(story).encode("11110011");

        assertThat(result.text()).isEqualTo("Once upon a time a baker buried the violin by the river .");
        assertThat(result.bitsEmbedded()).isEqualTo(8);
        assertThat(result.embeddedBits()).isEqualTo("11110011");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.accepted()).isTrue();
        assertThat(result.choices()).extracting(Choice::codeword).containsExactly("11", "110", "0", "11");
        verifyNoInteractions(random);
    }

    @Test
    void longPayloadIsEmbeddedAsAPrefix() {
        EncodeResult result = encoder(story).encode("0000000");

        assertThat(result.text()).isEqualTo("Once upon a time the fox found the violin in Boston .");
        assertThat(result.bitsEmbedded()).isEqualTo(4);
        assertThat(result.payload()).isEqualTo("0000000");
    }

    @Test
    void unmatchedBitsFallBackToWeightedChoiceAndStopEmbedding() {
        when(random.nextDouble()).thenReturn(0.0);

        EncodeResult result = encoder(story).encode("1");

        // SUBJECT has no codeword "1"; OBJECT must not pick the bit up behind it
        assertThat(result.text()).isEqualTo("Once upon a time the fox found a lantern in Boston .");
        assertThat(result.bitsEmbedded()).isZero();
        assertThat(result.choices()).noneMatch(Choice::consumedBits);
        verify(random, times(4)).nextDouble();
    }

    @Test
    void shortTailAfterAConsumedSlotIsNotEmbedded() {
        when(random.nextDouble()).thenReturn(0.0);

        EncodeResult result = encoder(story).encode("011");

        assertThat(result.embeddedBits()).isEqualTo("0");
        assertThat(result.choices()).filteredOn(Choice::consumedBits)
                .singleElement()
                .satisfies(c -> assertThat(c.symbol()).isEqualTo("SUBJECT"));
        verify(random, times(3)).nextDouble();
    }

    @Test
    void weightedChoiceFollowsCumulativeWeights() {
        when(random.nextDouble()).thenReturn(0.55, 0.75, 0.7, 0.99);

        EncodeResult result = encoder(story).encode("");

        assertThat(result.text()).isEqualTo("Once upon a time a baker sold the violin by the river .");
        assertThat(result.bitsEmbedded()).isZero();
    }

    @Test
    void repeatedSymbolConsumesBitsOnlyOnce() throws Exception {
        HuffmanCodeBuilder codes = new HuffmanCodeBuilder(GrammarParser.strict().parse(String.join("\n",
                "Start -> A A",
                "A -> x [0.5] | y [0.5]")));
        when(random.nextDouble()).thenReturn(0.9);

        EncodeResult result = encoder(codes).encode("00");

        assertThat(result.text()).isEqualTo("x y.");
        assertThat(result.bitsEmbedded()).isEqualTo(1);
        assertThat(result.choices()).extracting(Choice::codeword).containsExactly("0", "");
    }

    @Test
    void deterministicSymbolsNeitherConsumeNorRecord() {
        EncodeResult result = encoder(story).encode("0");

        assertThat(result.choices()).extracting(Choice::symbol).doesNotContain("Start", "Opening");
    }

    @Test
    void failedNaturalnessCheckIsRetried() {
        when(naturalness.isNatural(anyString())).thenReturn(false, false, true);

        EncodeResult result = encoder(story).encode("0000");

        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.accepted()).isTrue();
        assertThat(result.bitsEmbedded()).isEqualTo(4);
        verify(naturalness, times(3)).isNatural(anyString());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Encoder", messagePattern = "No natural sentence after 4 attempts.*")
    void exhaustedAttemptsReturnTheLastCandidate() {
        when(naturalness.isNatural(anyString())).thenReturn(false);

        EncodeResult result = new Encoder(story, naturalness, random, 4).encode("0000");

        assertThat(result.attempts()).isEqualTo(4);
        assertThat(result.accepted()).isFalse();
        assertThat(result.text()).isEqualTo("Once upon a time the fox found the violin in Boston .");
        verify(naturalness, times(4)).isNatural(anyString());
    }

    @Test
    void messageAndKeyAreHashedIntoThePayload() {
        lenient().when(random.nextDouble()).thenReturn(0.0);

        EncodeResult result = encoder(story).encode("attack at dawn", "k1", 96, 0);

        assertThat(result.payload()).isEqualTo(PayloadDeriver.derive("attack at dawn", "k1", 96));
        assertThat(result.embeddedBits()).isEqualTo(result.payload().substring(0, result.bitsEmbedded()));
        assertThat(result.bitsEmbedded()).isBetween(4, 8);
    }

    @Test
    void maxBitsCapsThePayload() {
        lenient().when(random.nextDouble()).thenReturn(0.0);

        EncodeResult result = encoder(story).encode("attack at dawn", "k1", 96, 3);

        assertThat(result.payload()).hasSize(3);
        assertThat(result.bitsEmbedded()).isLessThanOrEqualTo(3);
    }

    @Test
    void sameSeedGivesSameSentence() {
        Encoder first = new Encoder(story, naturalness, new SeededRandomProvider(42), 1);
        Encoder second = new Encoder(story, naturalness, new SeededRandomProvider(42), 1);

        assertThat(first.encode("").text()).isEqualTo(second.encode("").text());
    }

    @Test
    void nonTerminatingGrammarIsStopped() throws Exception {
        HuffmanCodeBuilder codes = new HuffmanCodeBuilder(GrammarParser.strict().parse("Start -> Start again"));

        assertThatThrownBy(() -> encoder(codes).encode(""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not terminate");
    }

    @Test
    void invalidPayloadIsRejected() {
        assertThatThrownBy(() -> encoder(story).encode("01a")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rendererAddsFinalPeriodOnlyWhenMissing() {
        assertThat(Encoder.render(List.of("Hello", "world"))).isEqualTo("Hello world.");
        assertThat(Encoder.render(List.of("Really", "?"))).isEqualTo("Really ?");
        assertThat(Encoder.render(List.of("Note:"))).isEqualTo("Note:");
        assertThat(Encoder.render(List.of())).isEqualTo(".");
    }
}
