package com.arxmlviewer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A port prototype owned by a software component.
 *
 * @param uuid unique identifier, generated per parse
 * @param shortName port short name (empty if the source had none)
 * @param direction provided or required, fixed by the source tag
 * @param description optional {@code DESC/L-2} text
 * @param componentUuid identifier of the owning component (back-reference, not ownership)
 * @param interfaceRef raw text of the port's interface reference, or null
 * @param interfaceUuid identifier of the resolved {@link PortInterface}, or null
 */
public record Port(
    String uuid,
    String shortName,
    PortDirection direction,
    String description,
    String componentUuid,
    String interfaceRef,
    String interfaceUuid
) {
    /**
     * Compact constructor with validation.
     */
    public Port {
        Objects.requireNonNull(uuid, "uuid must not be null");
        Objects.requireNonNull(componentUuid, "componentUuid must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        if (!direction.isRecognized()) {
            throw new IllegalArgumentException("Port direction must be PROVIDED or REQUIRED");
        }
        if (shortName == null) {
            shortName = "";
        }
    }

    @JsonIgnore
    public boolean isProvided() {
        return direction == PortDirection.PROVIDED;
    }

    @JsonIgnore
    public boolean isRequired() {
        return direction == PortDirection.REQUIRED;
    }

    /**
     * Returns a copy bound to the given resolved interface.
     *
     * @param resolvedInterfaceUuid interface identifier
     * @return new port with the interface set
     */
    public Port withInterfaceUuid(String resolvedInterfaceUuid) {
        return new Port(uuid, shortName, direction, description, componentUuid, interfaceRef, resolvedInterfaceUuid);
    }
}
