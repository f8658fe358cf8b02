package org.pcfgstego.api;

import com.typesafe.config.ConfigFactory;
import org.pcfgstego.codec.encode.EncodeResult;
import org.pcfgstego.codec.payload.PayloadDeriver;
import org.pcfgstego.config.CodecSettings;
import org.pcfgstego.grammar.Grammar;
import org.pcfgstego.grammar.GrammarParser;
import org.pcfgstego.grammar.api.GrammarFileNotFoundException;
import org.pcfgstego.junit.extensions.logging.AllowLog;
import org.pcfgstego.junit.extensions.logging.LogLevel;
import org.pcfgstego.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Encode and detect through the facade, end to end.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class StegoCodecTest {

    private static final String CITY_GRAMMAR = String.join("\n",
            "Start -> Greeting CITY .",
            "CITY -> \"Boston\" [0.5] | \"Denver\" [0.5]");

    private String storySource;
    private CodecSettings storySettings;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/grammars/story.grammar")) {
            storySource = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        storySettings = CodecSettings.fromConfig(ConfigFactory.parseString(String.join("\n",
                "pcfg-stego.naturalness.min-letters = 1000",
                "pcfg-stego.encoder.seed = 42",
                "pcfg-stego.detector.markers = [upon]",
                "pcfg-stego.detector.excluded-symbols = [static]")));
    }

    private StegoCodec storyCodec() throws Exception {
        return StegoCodec.create(GrammarParser.strict().parse(storySource), storySettings);
    }

    @Test
    void twoCitiesCarryTheFirstPayloadBit() throws Exception {
        CodecSettings settings = CodecSettings.fromConfig(ConfigFactory.parseString(
                "pcfg-stego.detector.markers = [Greeting]"));
        StegoCodec codec = StegoCodec.create(GrammarParser.strict().parse(CITY_GRAMMAR), settings);
        String payload = PayloadDeriver.derive("hi", "k1", 2);
        String city = payload.charAt(0) == '0' ? "Boston" : "Denver";

        EncodeResult encoded = codec.encode("hi", "k1", 2, 0);

        assertThat(encoded.text()).isEqualTo("Greeting " + city + " .");
        assertThat(encoded.bitsEmbedded()).isEqualTo(1);
        assertThat(encoded.accepted()).isTrue();

        DetectionReport report = codec.detect(encoded.text(), DetectOptions.none());
        assertThat(report.detected()).isTrue();
        assertThat(report.bits()).isEqualTo(payload.substring(0, 1));
        assertThat(report.recoveries()).isEmpty();
    }

    @Test
    void detectedBitsEqualTheEmbeddedPrefix() throws Exception {
        StegoCodec codec = storyCodec();

        for (String message : List.of("hello", "attack at dawn", "meet me at noon")) {
            EncodeResult encoded = codec.encode(message, "k1");

            DetectionReport report = codec.detect(encoded.text(), DetectOptions.none());

            assertThat(encoded.payload()).hasSize(96);
            assertThat(report.bits()).as(encoded.text()).isEqualTo(encoded.embeddedBits());
        }
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*Encoder", messagePattern = "No natural sentence after .*")
    void shortPayloadTailsStillDetectAsAPrefix() throws Exception {
        CodecSettings settings = CodecSettings.fromConfig(ConfigFactory.parseString(String.join("\n",
                "pcfg-stego.encoder.seed = 1",
                "pcfg-stego.detector.markers = [upon]",
                "pcfg-stego.detector.excluded-symbols = [static]")));
        StegoCodec codec = StegoCodec.create(GrammarParser.strict().parse(storySource), settings);

        for (int i = 0; i < 200; i++) {
            EncodeResult encoded = codec.encode("message " + i, "k1", 96, 3);

            DetectionReport report = codec.detect(encoded.text(), DetectOptions.none());

            assertThat(report.bits()).as(encoded.text()).startsWith(encoded.embeddedBits());
        }
    }

    @Test
    void keySearchRecoversKeyAndMessage() throws Exception {
        StegoCodec codec = storyCodec();
        EncodeResult encoded = codec.encode("attack at dawn", "k1");

        DetectionReport report = codec.detect(encoded.text(), DetectOptions.builder()
                .withKeys(List.of("k1", "k2"))
                .withMessages(List.of("attack at dawn"))
                .build());

        assertThat(report.recoveries()).isNotEmpty();
        assertThat(report.recoveries().get(0).key()).isEqualTo("k1");
        assertThat(report.recoveries().get(0).message()).isEqualTo("attack at dawn");
        assertThat(report.recoveries().get(0).confidence()).isEqualTo(1.0);
    }

    @Test
    void keySearchIsSkippedWhenNothingIsDetected() throws Exception {
        DetectionReport report = storyCodec().detect("No story here.", DetectOptions.builder()
                .withKeys(List.of("k1"))
                .build());

        assertThat(report.detected()).isFalse();
        assertThat(report.recoveries()).isEmpty();
    }

    @Test
    void maxBitsLimitsTheEmbeddedPrefix() throws Exception {
        EncodeResult encoded = storyCodec().encode("hello", "k1", 96, 2);

        assertThat(encoded.payload()).isEqualTo(PayloadDeriver.derive("hello", "k1", 2));
        assertThat(encoded.bitsEmbedded()).isLessThanOrEqualTo(2);
    }

    @Test
    void sameSeedReproducesTheSentence() throws Exception {
        assertThat(storyCodec().encode("", "", 0, 0).text()).isEqualTo(storyCodec().encode("", "", 0, 0).text());
    }

    @Test
    void capacityCountsFloorLog2OfAlternatives() throws Exception {
        CapacityReport report = storyCodec().capacity();

        assertThat(report.maxBits()).isEqualTo(5);
        assertThat(report.bitsPerSymbol()).containsExactly(
                Map.entry("SUBJECT", 1), Map.entry("VERB", 2), Map.entry("OBJECT", 1), Map.entry("PLACE", 1));
    }

    @Test
    void capacityIncludesStaticSymbolUnderAnotherName() throws Exception {
        CodecSettings settings = CodecSettings.fromConfig(ConfigFactory.parseString(
                "pcfg-stego.grammar.static-symbol = framing"));
        Grammar grammar = GrammarParser.strict().parse(storySource);

        assertThat(StegoCodec.create(grammar, settings).capacity().maxBits()).isEqualTo(6);
    }

    @Test
    void codeTablesAreExposed() throws Exception {
        StegoCodec codec = storyCodec();

        assertThat(codec.codeTable("OBJECT").asMap()).containsEntry("\"a lantern\"", "1");
        assertThat(codec.codeTable("OBJECT")).isSameAs(codec.codeTable("OBJECT"));
        assertThat(codec.grammar().startSymbol()).isEqualTo("Start");
    }

    @Test
    void grammarFileIsLoadedWithConfiguredParser(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("city.grammar");
        Files.writeString(file, CITY_GRAMMAR, StandardCharsets.UTF_8);

        StegoCodec codec = StegoCodec.fromFile(file, CodecSettings.defaults());

        assertThat(codec.capacity().maxBits()).isEqualTo(1);
        assertThatThrownBy(() -> StegoCodec.fromFile(dir.resolve("missing.grammar"), CodecSettings.defaults()))
                .isInstanceOf(GrammarFileNotFoundException.class);
    }
}
