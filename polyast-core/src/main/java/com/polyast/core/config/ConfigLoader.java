package com.polyast.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading PolyAST configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code polyast.yaml} into {@link PolyastConfig} records.
 * If the config file is missing or invalid, returns {@link PolyastConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PolyastConfig config = ConfigLoader.load(Paths.get("polyast.yaml"));
 *
 * if (config.languages().isEnabled(Language.JAVA)) {
 *     // Java files are normalized
 * }
 * }</pre>
 */
public class ConfigLoader {

    /** Default configuration file name, looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "polyast.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link PolyastConfig#defaults()}.
     *
     * @param configPath path to {@code polyast.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static PolyastConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults (all languages enabled).", configPath);
            return PolyastConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return PolyastConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            PolyastConfig config = YAML_MAPPER.readValue(configPath.toFile(), PolyastConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return PolyastConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return PolyastConfig.defaults();
        }
    }

    /**
     * Loads the configuration from an explicit path, or from {@value #DEFAULT_FILE_NAME}
     * in the working directory when the path is null. Silently uses defaults when the
     * implicit file is absent.
     *
     * @param configPath explicit path or null
     * @return loaded configuration or defaults
     */
    public static PolyastConfig loadOrDefaults(Path configPath) {
        if (configPath != null) {
            return load(configPath);
        }
        Path implicit = Path.of(DEFAULT_FILE_NAME);
        return Files.exists(implicit) ? load(implicit) : PolyastConfig.defaults();
    }
}
