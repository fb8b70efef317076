package com.arxmlviewer.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A port interface declared in a package.
 *
 * @param uuid unique identifier, generated per parse
 * @param shortName interface short name
 * @param interfaceType interface kind
 * @param description optional description
 * @param packagePath full path of the owning package
 * @param dataElements data elements (sender-receiver, NV data and mode switch interfaces)
 * @param operations operations (client-server interfaces) or triggers (trigger interfaces)
 */
public record PortInterface(
    String uuid,
    String shortName,
    InterfaceType interfaceType,
    String description,
    String packagePath,
    List<DataElement> dataElements,
    List<Operation> operations
) {
    public PortInterface {
        Objects.requireNonNull(uuid, "uuid must not be null");
        Objects.requireNonNull(interfaceType, "interfaceType must not be null");
        if (shortName == null) {
            shortName = "";
        }
        if (packagePath == null) {
            packagePath = "";
        }
        dataElements = dataElements == null ? List.of() : List.copyOf(dataElements);
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    /**
     * Returns the AUTOSAR reference path of this interface.
     *
     * @return package path plus short name, e.g. {@code /Interfaces/SpeedIf}
     */
    public String fullPath() {
        return packagePath + "/" + shortName;
    }

    public Optional<DataElement> findDataElement(String name) {
        return dataElements.stream().filter(element -> element.name().equals(name)).findFirst();
    }

    public Optional<Operation> findOperation(String name) {
        return operations.stream().filter(operation -> operation.name().equals(name)).findFirst();
    }
}
