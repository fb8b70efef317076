package com.arxmlviewer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One end of a {@link Connection}.
 *
 * <p>Endpoints refer to components and ports by identifier only. When the
 * referenced prototype or port cannot be found, the identifier is null and the
 * raw references are kept so that callers can report the dangling reference.
 *
 * @param contextRef raw context component reference, empty for outer ports of the composition
 * @param portRef raw target port reference
 * @param prototypeName role name the context reference points to, empty for outer ports
 * @param portName short name of the target port
 * @param componentUuid resolved component identifier, or null
 * @param portUuid resolved port identifier, or null
 */
public record ConnectionEndpoint(
    String contextRef,
    String portRef,
    String prototypeName,
    String portName,
    String componentUuid,
    String portUuid
) {
    public ConnectionEndpoint {
        if (contextRef == null) {
            contextRef = "";
        }
        if (portRef == null) {
            portRef = "";
        }
        if (prototypeName == null) {
            prototypeName = "";
        }
        if (portName == null) {
            portName = "";
        }
    }

    /**
     * Returns true if both the component and the port were found.
     *
     * @return false for a dangling endpoint
     */
    @JsonIgnore
    public boolean isResolved() {
        return componentUuid != null && portUuid != null;
    }
}
