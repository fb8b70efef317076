package com.arxmlviewer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings passed to {@link com.arxmlviewer.core.parser.ArxmlParser}.
 *
 * <p>The parser itself accepts files of any size. {@code maxFileSizeMb} is
 * enforced by callers before they hand a file to the parser.
 *
 * @param validateXml check the AUTOSAR root heuristic and log a warning for non-AUTOSAR documents
 * @param resolveReferences run the second pass (prototypes, connectors, interface references)
 * @param parseInterfaces parse port interfaces declared in packages
 * @param maxFileSizeMb callers reject larger files; zero or negative disables the limit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserOptions(
    @JsonProperty("validateXml") Boolean validateXml,
    @JsonProperty("resolveReferences") Boolean resolveReferences,
    @JsonProperty("parseInterfaces") Boolean parseInterfaces,
    @JsonProperty("maxFileSizeMb") Integer maxFileSizeMb
) {
    /** Default size limit in megabytes */
    public static final int DEFAULT_MAX_FILE_SIZE_MB = 500;

    /**
     * Compact constructor applying defaults to missing values.
     */
    public ParserOptions {
        if (validateXml == null) {
            validateXml = true;
        }
        if (resolveReferences == null) {
            resolveReferences = true;
        }
        if (parseInterfaces == null) {
            parseInterfaces = true;
        }
        if (maxFileSizeMb == null) {
            maxFileSizeMb = DEFAULT_MAX_FILE_SIZE_MB;
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(true, true, true, DEFAULT_MAX_FILE_SIZE_MB);
    }

    /**
     * Returns the size limit in bytes.
     *
     * @return limit, or {@link Long#MAX_VALUE} when disabled
     */
    public long maxFileSizeBytes() {
        return maxFileSizeMb <= 0 ? Long.MAX_VALUE : maxFileSizeMb * 1024L * 1024L;
    }
}
