package com.arxmlviewer.core.model;

import java.util.Objects;

/**
 * An argument of a client-server operation.
 *
 * @param name argument short name
 * @param direction argument direction
 * @param typeRef raw {@code TYPE-TREF} text, or null
 * @param description optional description
 */
public record OperationArgument(
    String name,
    ArgumentDirection direction,
    String typeRef,
    String description
) {
    public OperationArgument {
        Objects.requireNonNull(direction, "direction must not be null");
        if (name == null) {
            name = "";
        }
    }

    public String typeName() {
        return DataElement.typeName(typeRef);
    }
}
