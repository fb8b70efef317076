package com.arxmlviewer.core.model;

/**
 * AUTOSAR port interface kinds.
 */
public enum InterfaceType {
    SENDER_RECEIVER("SENDER-RECEIVER-INTERFACE"),
    CLIENT_SERVER("CLIENT-SERVER-INTERFACE"),
    TRIGGER("TRIGGER-INTERFACE"),
    MODE_SWITCH("MODE-SWITCH-INTERFACE"),
    NV_DATA("NV-DATA-INTERFACE"),
    UNKNOWN("");

    private final String tag;

    InterfaceType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isRecognized() {
        return this != UNKNOWN;
    }

    /**
     * Maps an element local name to an interface kind.
     *
     * @param tag element local name, may be null
     * @return matching kind or {@link #UNKNOWN}
     */
    public static InterfaceType fromTag(String tag) {
        if (tag == null || tag.isEmpty()) {
            return UNKNOWN;
        }
        for (InterfaceType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
