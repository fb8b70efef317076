package com.arxmlviewer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A component prototype (role) declared inside a composition.
 *
 * @param shortName role name of the prototype
 * @param typeRef raw {@code TYPE-TREF} text
 * @param componentUuid identifier of the referenced component type, or null if unresolved
 */
public record ComponentPrototype(
    String shortName,
    String typeRef,
    String componentUuid
) {
    public ComponentPrototype {
        if (shortName == null) {
            shortName = "";
        }
        if (typeRef == null) {
            typeRef = "";
        }
    }

    @JsonIgnore
    public boolean isResolved() {
        return componentUuid != null;
    }
}
