package com.arxmlviewer.core.parser;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Metadata returned alongside the package forest.
 *
 * @param filePath parsed file
 * @param fileSize file size in bytes
 * @param parseTimeSeconds elapsed wall-clock time
 * @param statistics entity counts
 * @param debugInfo resolution and skip counters
 * @param namespaces prefix to URI map used for queries, synthetic prefix included
 * @param autosarVersion schema version from {@code xsi:schemaLocation}, or {@code Unknown}
 * @param autosarDocument whether the root looks like an AUTOSAR document
 */
public record ParseMetadata(
    @JsonProperty("file_path") String filePath,
    @JsonProperty("file_size") long fileSize,
    @JsonProperty("parse_time") double parseTimeSeconds,
    @JsonProperty("statistics") ParseStatistics statistics,
    @JsonProperty("debug_info") DebugInfo debugInfo,
    @JsonProperty("namespaces") Map<String, String> namespaces,
    @JsonProperty("autosar_version") String autosarVersion,
    @JsonProperty("autosar_document") boolean autosarDocument
) {
    /** Version reported when the schema location names no known release */
    public static final String UNKNOWN_VERSION = "Unknown";

    public ParseMetadata {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (statistics == null) {
            statistics = ParseStatistics.empty();
        }
        if (debugInfo == null) {
            debugInfo = DebugInfo.empty();
        }
        namespaces = namespaces == null ? Map.of() : Map.copyOf(namespaces);
        if (autosarVersion == null || autosarVersion.isBlank()) {
            autosarVersion = UNKNOWN_VERSION;
        }
    }
}
