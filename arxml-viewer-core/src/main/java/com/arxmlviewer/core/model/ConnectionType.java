package com.arxmlviewer.core.model;

/**
 * Kinds of connectors inside a composition.
 */
public enum ConnectionType {
    /** Connects a provided port of one prototype to a required port of another */
    ASSEMBLY("ASSEMBLY-SW-CONNECTOR"),

    /** Connects an inner prototype port to an outer port of the composition */
    DELEGATION("DELEGATION-SW-CONNECTOR"),

    /** Connects two outer ports of the composition */
    PASS_THROUGH("PASS-THROUGH-SW-CONNECTOR"),

    /** Unrecognized connector tag */
    UNKNOWN("");

    private final String tag;

    ConnectionType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isRecognized() {
        return this != UNKNOWN;
    }

    /**
     * Maps an element local name to a connector kind.
     *
     * @param tag element local name, may be null
     * @return matching kind or {@link #UNKNOWN}
     */
    public static ConnectionType fromTag(String tag) {
        if (tag == null || tag.isEmpty()) {
            return UNKNOWN;
        }
        for (ConnectionType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
