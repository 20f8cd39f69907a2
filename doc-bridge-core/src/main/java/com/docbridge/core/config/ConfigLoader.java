package com.docbridge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading DocBridge configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code docbridge.yaml} into {@link ConverterConfig} records.
 * If the config file is missing or invalid, returns {@link ConverterConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConverterConfig config = ConfigLoader.load(Path.of("docbridge.yaml"));
 * TranslatorOptions options = config.toTranslatorOptions();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Name of the configuration file looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "docbridge.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, can't be read or can't be parsed, logs why and returns
     * {@link ConverterConfig#defaults()}.
     *
     * @param configPath path to {@code docbridge.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ConverterConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ConverterConfig config = YAML_MAPPER.readValue(configPath.toFile(), ConverterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ConverterConfig.defaults();
            }
            // fail early on values the translator would reject later
            config.toTranslatorOptions();
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ConverterConfig.defaults();
        }
    }
}
