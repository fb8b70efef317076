package com.arxmlviewer.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ViewerConfig} from YAML files.
 *
 * <p>Never throws: a missing, unreadable or invalid file yields
 * {@link ViewerConfig#defaults()} and a log message.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ViewerConfig config = ConfigLoader.load(Path.of("arxml-viewer.yaml"));
 * ArxmlParser parser = new ArxmlParser(config.parser());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Conventional configuration file name */
    public static final String DEFAULT_FILE_NAME = "arxml-viewer.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code arxml-viewer.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ViewerConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ViewerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ViewerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ViewerConfig config = YAML_MAPPER.readValue(configPath.toFile(), ViewerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ViewerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ViewerConfig.defaults();
        }
    }
}
