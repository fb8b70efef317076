package com.arxmlviewer.core.model;

/**
 * A data element of a port interface.
 *
 * <p>Sender-receiver and NV data interfaces declare these as
 * {@code VARIABLE-DATA-PROTOTYPE}s; mode switch interfaces contribute their
 * mode declaration groups.
 *
 * @param name element short name
 * @param typeRef raw {@code TYPE-TREF} text, or null
 * @param description optional description
 */
public record DataElement(
    String name,
    String typeRef,
    String description
) {
    /** Type name reported when no type reference is given */
    public static final String UNKNOWN_TYPE = "Unknown";

    public DataElement {
        if (name == null) {
            name = "";
        }
    }

    /**
     * Returns the referenced type's short name.
     *
     * @return last segment of the type reference, or {@code "Unknown"} without one
     */
    public String typeName() {
        return typeName(typeRef);
    }

    static String typeName(String typeRef) {
        if (typeRef == null || typeRef.isBlank()) {
            return UNKNOWN_TYPE;
        }
        String trimmed = typeRef.trim();
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }
}
