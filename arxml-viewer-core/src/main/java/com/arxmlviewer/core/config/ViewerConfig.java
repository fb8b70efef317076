package com.arxmlviewer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for the ARXML viewer.
 *
 * <p>Loaded from {@code arxml-viewer.yaml}. Missing sections fall back to
 * their defaults, so a partial file is always usable.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   validateXml: true
 *   resolveReferences: true
 *   parseInterfaces: true
 *   maxFileSizeMb: 500
 *
 * output:
 *   format: text
 *   showPorts: true
 *   showConnections: false
 * }</pre>
 *
 * @param parser parser settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ViewerConfig(
    @JsonProperty("parser") ParserOptions parser,
    @JsonProperty("output") OutputOptions output
) {
    /**
     * Compact constructor filling in default sections.
     */
    public ViewerConfig {
        if (parser == null) {
            parser = ParserOptions.defaults();
        }
        if (output == null) {
            output = OutputOptions.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ViewerConfig defaults() {
        return new ViewerConfig(ParserOptions.defaults(), OutputOptions.defaults());
    }

    /**
     * Output settings used by the command line front end.
     *
     * @param format {@code text} or {@code json}
     * @param showPorts whether to list ports under each component
     * @param showConnections whether to list composition connectors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputOptions(
        @JsonProperty("format") String format,
        @JsonProperty("showPorts") Boolean showPorts,
        @JsonProperty("showConnections") Boolean showConnections
    ) {
        public OutputOptions {
            if (format == null || format.isBlank()) {
                format = "text";
            }
            if (showPorts == null) {
                showPorts = true;
            }
            if (showConnections == null) {
                showConnections = false;
            }
        }

        public static OutputOptions defaults() {
            return new OutputOptions("text", true, false);
        }

        public boolean isJson() {
            return "json".equalsIgnoreCase(format);
        }
    }
}
