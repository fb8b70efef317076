package com.arxmlviewer.core.model;

/**
 * AUTOSAR software component kinds, keyed by their ARXML element tag.
 *
 * <p>{@link #UNKNOWN} is the fallback for any tag that is not one of the
 * recognized {@code *-SW-COMPONENT-TYPE} elements. Components of that kind
 * are never modeled; the parser skips and counts them.
 */
public enum ComponentType {
    /** Application software component */
    APPLICATION("APPLICATION-SW-COMPONENT-TYPE"),

    /** Composition aggregating component prototypes and connectors */
    COMPOSITION("COMPOSITION-SW-COMPONENT-TYPE"),

    /** Basic software service component */
    SERVICE("SERVICE-SW-COMPONENT-TYPE"),

    /** Sensor/actuator component */
    SENSOR_ACTUATOR("SENSOR-ACTUATOR-SW-COMPONENT-TYPE"),

    /** Complex device driver */
    COMPLEX_DEVICE_DRIVER("COMPLEX-DEVICE-DRIVER-SW-COMPONENT-TYPE"),

    /** ECU abstraction component */
    ECU_ABSTRACTION("ECU-ABSTRACTION-SW-COMPONENT-TYPE"),

    /** Service proxy component */
    SERVICE_PROXY("SERVICE-PROXY-SW-COMPONENT-TYPE"),

    /** NV block component */
    NV_BLOCK("NV-BLOCK-SW-COMPONENT-TYPE"),

    /** Parameter (calibration) component */
    PARAMETER("PARAMETER-SW-COMPONENT-TYPE"),

    /** Unrecognized tag */
    UNKNOWN("");

    private final String tag;

    ComponentType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the ARXML element tag for this kind.
     *
     * @return element local name, empty for {@link #UNKNOWN}
     */
    public String tag() {
        return tag;
    }

    /**
     * Returns true if this is a modeled kind.
     *
     * @return false only for {@link #UNKNOWN}
     */
    public boolean isRecognized() {
        return this != UNKNOWN;
    }

    /**
     * Maps an element local name to a component kind.
     *
     * @param tag element local name, may be null
     * @return matching kind or {@link #UNKNOWN}
     */
    public static ComponentType fromTag(String tag) {
        if (tag == null || tag.isEmpty()) {
            return UNKNOWN;
        }
        for (ComponentType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Returns true if the tag names any software component type, recognized or not.
     *
     * @param tag element local name
     * @return true for {@code *-SW-COMPONENT-TYPE} tags
     */
    public static boolean isComponentTag(String tag) {
        return tag != null && tag.endsWith("-SW-COMPONENT-TYPE");
    }
}
