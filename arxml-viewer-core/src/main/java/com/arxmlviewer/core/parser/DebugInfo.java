package com.arxmlviewer.core.parser;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic counters for composition resolution and skipped content.
 *
 * <p>Resolution problems never fail a parse; they show up here instead.
 *
 * @param compositionsFound composition components encountered
 * @param prototypesAttempted prototype lookups tried (type references and connector contexts)
 * @param prototypesSuccessful prototype lookups that found their target
 * @param standaloneComponents non-composition components
 * @param unresolvedEndpoints connector endpoints left without a component or port
 * @param unresolvedInterfaceRefs port interface references that matched no interface
 * @param skippedTags unrecognized element tags and how often each was skipped
 */
public record DebugInfo(
    @JsonProperty("compositions_found") int compositionsFound,
    @JsonProperty("prototypes_attempted") int prototypesAttempted,
    @JsonProperty("prototypes_successful") int prototypesSuccessful,
    @JsonProperty("standalone_components") int standaloneComponents,
    @JsonProperty("unresolved_endpoints") int unresolvedEndpoints,
    @JsonProperty("unresolved_interface_refs") int unresolvedInterfaceRefs,
    @JsonProperty("skipped_tags") Map<String, Integer> skippedTags
) {
    public DebugInfo {
        if (skippedTags == null) {
            skippedTags = Map.of();
        }
    }

    public static DebugInfo empty() {
        return new DebugInfo(0, 0, 0, 0, 0, 0, Map.of());
    }

    /**
     * Returns how many elements were skipped in total.
     *
     * @return sum of all skipped tag counts
     */
    public int totalSkipped() {
        return skippedTags.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Builder shared by both parser passes.
     */
    public static class Builder {
        private int compositionsFound = 0;
        private int prototypesAttempted = 0;
        private int prototypesSuccessful = 0;
        private int standaloneComponents = 0;
        private int unresolvedEndpoints = 0;
        private int unresolvedInterfaceRefs = 0;
        private final Map<String, Integer> skippedTags = new LinkedHashMap<>();

        public Builder incrementCompositionsFound() {
            this.compositionsFound++;
            return this;
        }

        public Builder incrementStandaloneComponents() {
            this.standaloneComponents++;
            return this;
        }

        /**
         * Records one prototype lookup.
         *
         * @param successful whether the lookup found its target
         * @return this builder
         */
        public Builder recordPrototypeAttempt(boolean successful) {
            this.prototypesAttempted++;
            if (successful) {
                this.prototypesSuccessful++;
            }
            return this;
        }

        public Builder incrementUnresolvedEndpoints() {
            this.unresolvedEndpoints++;
            return this;
        }

        public Builder incrementUnresolvedInterfaceRefs() {
            this.unresolvedInterfaceRefs++;
            return this;
        }

        public Builder recordSkipped(String tag) {
            skippedTags.merge(tag, 1, Integer::sum);
            return this;
        }

        public DebugInfo build() {
            return new DebugInfo(
                compositionsFound,
                prototypesAttempted,
                prototypesSuccessful,
                standaloneComponents,
                unresolvedEndpoints,
                unresolvedInterfaceRefs,
                Map.copyOf(skippedTags)
            );
        }
    }
}
