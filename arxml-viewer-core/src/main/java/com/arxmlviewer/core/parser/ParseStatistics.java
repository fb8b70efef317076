package com.arxmlviewer.core.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entity counts collected while parsing one file.
 *
 * <p><b>Invariant:</b> {@code componentsParsed} and {@code portsParsed} equal the
 * number of components and ports reachable from the returned package forest.
 *
 * @param packagesParsed packages in the forest, nested ones included
 * @param componentsParsed modeled components
 * @param portsParsed modeled ports
 * @param connectionsParsed connectors recorded in the second pass
 * @param interfacesParsed port interfaces
 * @param parseTimeSeconds elapsed wall-clock time
 */
public record ParseStatistics(
    @JsonProperty("packages_parsed") int packagesParsed,
    @JsonProperty("components_parsed") int componentsParsed,
    @JsonProperty("ports_parsed") int portsParsed,
    @JsonProperty("connections_parsed") int connectionsParsed,
    @JsonProperty("interfaces_parsed") int interfacesParsed,
    @JsonProperty("parse_time") double parseTimeSeconds
) {
    public ParseStatistics {
        if (parseTimeSeconds < 0) {
            parseTimeSeconds = 0;
        }
    }

    public static ParseStatistics empty() {
        return new ParseStatistics(0, 0, 0, 0, 0, 0);
    }

    /**
     * Returns a one-line summary for logs and console output.
     *
     * @return summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format(
            "Packages: %d, Components: %d, Ports: %d, Connections: %d, Interfaces: %d (%.3fs)",
            packagesParsed,
            componentsParsed,
            portsParsed,
            connectionsParsed,
            interfacesParsed,
            parseTimeSeconds
        );
    }

    /**
     * Builder for counting entities during the walk.
     */
    public static class Builder {
        private int packagesParsed = 0;
        private int componentsParsed = 0;
        private int portsParsed = 0;
        private int connectionsParsed = 0;
        private int interfacesParsed = 0;

        public Builder incrementPackages() {
            this.packagesParsed++;
            return this;
        }

        public Builder incrementComponents() {
            this.componentsParsed++;
            return this;
        }

        public Builder incrementPorts() {
            this.portsParsed++;
            return this;
        }

        public Builder incrementInterfaces() {
            this.interfacesParsed++;
            return this;
        }

        public Builder connectionsParsed(int count) {
            this.connectionsParsed = count;
            return this;
        }

        public ParseStatistics build(double parseTimeSeconds) {
            return new ParseStatistics(
                packagesParsed,
                componentsParsed,
                portsParsed,
                connectionsParsed,
                interfacesParsed,
                parseTimeSeconds
            );
        }
    }
}
