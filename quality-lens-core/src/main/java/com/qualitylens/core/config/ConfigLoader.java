package com.qualitylens.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.qualitylens.core.util.Sanitizers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading analyzer configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code quality-lens.yaml} into {@link AnalyzerConfig} records.
 * If the config file is missing or invalid, returns {@link AnalyzerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(Path.of("quality-lens.yaml"));
 * AnalysisEngine engine = AnalysisEngine.builder().config(config).build();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "quality-lens.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link AnalyzerConfig#defaults()}.
     *
     * @param configPath path to {@code quality-lens.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        String displayName = Sanitizers.sanitizePath(configPath == null ? null : configPath.toString());
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", displayName);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", displayName);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", displayName);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", displayName);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", displayName);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                displayName, Sanitizers.sanitizeError(e));
            return AnalyzerConfig.defaults();
        }
    }

    /**
     * Loads {@code quality-lens.yaml} from a project directory, or returns defaults.
     *
     * @param projectRoot project directory
     * @return loaded configuration or defaults
     */
    public static AnalyzerConfig loadFromDirectory(Path projectRoot) {
        return load(projectRoot.resolve(DEFAULT_FILE_NAME));
    }
}
