package com.arxmlviewer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A connector between two port endpoints inside a composition.
 *
 * <p>For delegation connectors whose inner port is required, the outer port
 * is the provider side. Pass-through connectors use the provided outer port as
 * provider and the required outer port as requester.
 *
 * @param uuid unique identifier, generated per parse
 * @param shortName connector short name (empty if absent)
 * @param connectionType connector kind
 * @param compositionUuid identifier of the composition declaring the connector
 * @param provider provider-side endpoint
 * @param requester requester-side endpoint
 */
public record Connection(
    String uuid,
    String shortName,
    ConnectionType connectionType,
    String compositionUuid,
    ConnectionEndpoint provider,
    ConnectionEndpoint requester
) {
    public Connection {
        Objects.requireNonNull(uuid, "uuid must not be null");
        Objects.requireNonNull(connectionType, "connectionType must not be null");
        Objects.requireNonNull(compositionUuid, "compositionUuid must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(requester, "requester must not be null");
        if (shortName == null) {
            shortName = "";
        }
    }

    /**
     * Returns true if both endpoints resolved.
     *
     * @return false if either endpoint is dangling
     */
    @JsonIgnore
    public boolean isResolved() {
        return provider.isResolved() && requester.isResolved();
    }

    public boolean involvesComponent(String componentUuid) {
        return componentUuid != null
            && (componentUuid.equals(provider.componentUuid()) || componentUuid.equals(requester.componentUuid()));
    }

    public boolean involvesPort(String portUuid) {
        return portUuid != null
            && (portUuid.equals(provider.portUuid()) || portUuid.equals(requester.portUuid()));
    }
}
