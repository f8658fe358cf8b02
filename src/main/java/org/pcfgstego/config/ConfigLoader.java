package org.pcfgstego.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the optional configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "pcfg-stego.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with this precedence, highest first:
     * 1. Java system properties ({@code -Dpcfg-stego.encoder.max-attempts=30})
     * 2. Environment variables
     * 3. {@code pcfg-stego.conf} in the working directory
     * 4. {@code reference.conf} on the classpath
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return layer(fileConfig);
    }

    /**
     * Same precedence as {@link #load()}, with an explicit file in place of {@code pcfg-stego.conf}.
     *
     * @param configFile The configuration file; must exist.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file does not exist.
     */
    public static Config load(final File configFile) {
        if (!configFile.isFile()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
        return layer(ConfigFactory.parseFile(configFile));
    }

    /**
     * Same precedence as {@link #load()}, with a classpath resource in place of the file.
     *
     * @param resource The classpath resource name.
     * @return The resolved configuration.
     */
    public static Config loadResource(final String resource) {
        return layer(ConfigFactory.parseResources(resource));
    }

    private static Config layer(final Config fileConfig) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
