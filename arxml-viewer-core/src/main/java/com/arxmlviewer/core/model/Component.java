package com.arxmlviewer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An AUTOSAR software component type.
 *
 * <p>Ports are kept in document order regardless of direction. Compositions
 * additionally carry the component prototypes they declare; for any other kind
 * the prototype list is empty.
 *
 * @param uuid unique identifier, generated per parse
 * @param shortName component short name (empty if the source had none)
 * @param componentType recognized component kind
 * @param description optional {@code DESC/L-2} text
 * @param packagePath full path of the owning package
 * @param ports ports in document order
 * @param prototypes component prototypes (compositions only)
 */
public record Component(
    String uuid,
    String shortName,
    ComponentType componentType,
    String description,
    String packagePath,
    List<Port> ports,
    List<ComponentPrototype> prototypes
) {
    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(uuid, "uuid must not be null");
        Objects.requireNonNull(componentType, "componentType must not be null");
        if (!componentType.isRecognized()) {
            throw new IllegalArgumentException("Component type must be a recognized AUTOSAR component kind");
        }
        if (shortName == null) {
            shortName = "";
        }
        if (packagePath == null) {
            packagePath = "";
        }
        ports = ports == null ? List.of() : List.copyOf(ports);
        prototypes = prototypes == null ? List.of() : List.copyOf(prototypes);
    }

    /**
     * Returns the AUTOSAR reference path of this component.
     *
     * @return package path plus short name, e.g. {@code /Demo/SensorComponent}
     */
    public String fullPath() {
        return packagePath + "/" + shortName;
    }

    @JsonIgnore
    public boolean isComposition() {
        return componentType == ComponentType.COMPOSITION;
    }

    public List<Port> providedPorts() {
        return ports.stream().filter(Port::isProvided).toList();
    }

    public List<Port> requiredPorts() {
        return ports.stream().filter(Port::isRequired).toList();
    }

    /**
     * Finds a port by short name.
     *
     * @param name port short name
     * @return first port with that name
     */
    public Optional<Port> findPort(String name) {
        return ports.stream().filter(port -> port.shortName().equals(name)).findFirst();
    }

    /**
     * Mutable builder used while a package tree is being walked.
     *
     * <p>The identifier is fixed at construction so that cross references can
     * point at the component before it is built.
     */
    public static class Builder {
        private final String uuid = UUID.randomUUID().toString();
        private final String shortName;
        private final ComponentType componentType;
        private final String description;
        private final String packagePath;
        private final List<Port> ports = new ArrayList<>();
        private final List<ComponentPrototype> prototypes = new ArrayList<>();

        public Builder(String shortName, ComponentType componentType, String description, String packagePath) {
            this.shortName = shortName == null ? "" : shortName;
            this.componentType = Objects.requireNonNull(componentType, "componentType must not be null");
            this.description = description;
            this.packagePath = packagePath == null ? "" : packagePath;
        }

        public String uuid() {
            return uuid;
        }

        public String shortName() {
            return shortName;
        }

        public ComponentType componentType() {
            return componentType;
        }

        public String packagePath() {
            return packagePath;
        }

        public String fullPath() {
            return packagePath + "/" + shortName;
        }

        public List<Port> ports() {
            return List.copyOf(ports);
        }

        /**
         * Creates a port owned by this component and appends it.
         *
         * @param portName short name
         * @param direction provided or required
         * @param portDescription optional description
         * @param interfaceRef raw interface reference, or null
         * @return the new port
         */
        public Port addPort(String portName, PortDirection direction, String portDescription, String interfaceRef) {
            Port port = new Port(UUID.randomUUID().toString(), portName, direction, portDescription,
                uuid, interfaceRef, null);
            ports.add(port);
            return port;
        }

        /**
         * Replaces a port in place, keeping its position.
         *
         * @param port updated port with the same identifier
         */
        public void replacePort(Port port) {
            for (int i = 0; i < ports.size(); i++) {
                if (ports.get(i).uuid().equals(port.uuid())) {
                    ports.set(i, port);
                    return;
                }
            }
            throw new IllegalArgumentException("Port " + port.uuid() + " does not belong to component " + uuid);
        }

        public Optional<Port> findPort(String name) {
            return ports.stream().filter(port -> port.shortName().equals(name)).findFirst();
        }

        public Builder addPrototype(ComponentPrototype prototype) {
            prototypes.add(Objects.requireNonNull(prototype, "prototype must not be null"));
            return this;
        }

        public List<ComponentPrototype> prototypes() {
            return List.copyOf(prototypes);
        }

        /**
         * Replaces the prototype at a position, typically with its resolved form.
         *
         * @param index position in declaration order
         * @param prototype replacement
         */
        public void replacePrototype(int index, ComponentPrototype prototype) {
            prototypes.set(index, Objects.requireNonNull(prototype, "prototype must not be null"));
        }

        /**
         * Finds a prototype by role name.
         *
         * @param name prototype short name
         * @return first prototype with that name
         */
        public Optional<ComponentPrototype> findPrototype(String name) {
            return prototypes.stream().filter(prototype -> prototype.shortName().equals(name)).findFirst();
        }

        public Component build() {
            return new Component(uuid, shortName, componentType, description, packagePath, ports, prototypes);
        }
    }
}
