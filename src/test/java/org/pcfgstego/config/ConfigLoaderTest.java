package org.pcfgstego.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConfigLoaderTest {

    private static final String ATTEMPTS = "pcfg-stego.encoder.max-attempts";

    @AfterEach
    void tearDown() {
        System.clearProperty(ATTEMPTS);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void resourceOverridesReferenceConf() {
        Config config = ConfigLoader.loadResource("test-pcfg-stego.conf");

        assertThat(config.getInt(ATTEMPTS)).isEqualTo(7);
        assertThat(config.getStringList("pcfg-stego.detector.markers")).containsExactly("upon");
        assertThat(config.getInt("pcfg-stego.encoder.payload-bits")).isEqualTo(96);
    }

    @Test
    void systemPropertyWinsOverFile() {
        System.setProperty(ATTEMPTS, "30");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadResource("test-pcfg-stego.conf");

        assertThat(config.getInt(ATTEMPTS)).isEqualTo(30);
    }

    @Test
    void explicitFileIsLoaded(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "pcfg-stego.search.key-threshold = 0.75\n", StandardCharsets.UTF_8);

        CodecSettings settings = CodecSettings.fromConfig(ConfigLoader.load(file.toFile()));

        assertThat(settings.search().keyThreshold()).isEqualTo(0.75);
    }

    @Test
    void missingExplicitFileIsRejected(@TempDir Path dir) {
        File missing = dir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.conf");
    }
}
