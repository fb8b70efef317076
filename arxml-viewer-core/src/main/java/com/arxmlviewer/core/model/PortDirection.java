package com.arxmlviewer.core.model;

/**
 * Direction of an AUTOSAR port prototype.
 */
public enum PortDirection {
    /** {@code P-PORT-PROTOTYPE} */
    PROVIDED("P-PORT-PROTOTYPE"),

    /** {@code R-PORT-PROTOTYPE} */
    REQUIRED("R-PORT-PROTOTYPE"),

    /** Any other port tag; never assigned to a modeled port */
    UNKNOWN("");

    private final String tag;

    PortDirection(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isRecognized() {
        return this != UNKNOWN;
    }

    /**
     * Maps an element local name to a port direction.
     *
     * @param tag element local name, may be null
     * @return matching direction or {@link #UNKNOWN}
     */
    public static PortDirection fromTag(String tag) {
        if (PROVIDED.tag.equals(tag)) {
            return PROVIDED;
        }
        if (REQUIRED.tag.equals(tag)) {
            return REQUIRED;
        }
        return UNKNOWN;
    }
}
