package com.arxmlviewer.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An AUTOSAR package ({@code AR-PACKAGE}) and the tree below it.
 *
 * <p>Children know nothing about their parent; callers reconstruct parent
 * links from the tree when they need them.
 *
 * @param uuid unique identifier, generated per parse
 * @param shortName package short name (empty if the source had none)
 * @param fullPath parent path + "/" + short name, e.g. {@code /Demo/Actuators}
 * @param description optional {@code DESC/L-2} text
 * @param components components in document order
 * @param interfaces port interfaces in document order
 * @param subPackages nested packages in document order
 */
public record ArPackage(
    String uuid,
    String shortName,
    String fullPath,
    String description,
    List<Component> components,
    List<PortInterface> interfaces,
    List<ArPackage> subPackages
) {
    /**
     * Compact constructor with validation.
     */
    public ArPackage {
        Objects.requireNonNull(uuid, "uuid must not be null");
        if (shortName == null) {
            shortName = "";
        }
        if (fullPath == null) {
            fullPath = "/" + shortName;
        }
        components = components == null ? List.of() : List.copyOf(components);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        subPackages = subPackages == null ? List.of() : List.copyOf(subPackages);
    }

    /**
     * Returns the path split into package names.
     *
     * @return path segments, outermost first
     */
    public List<String> pathSegments() {
        return Arrays.stream(fullPath.split("/"))
            .filter(segment -> !segment.isEmpty())
            .toList();
    }

    /**
     * Returns the nesting depth; root packages have depth 1.
     *
     * @return number of path segments
     */
    public int depth() {
        return pathSegments().size();
    }

    /**
     * Returns the components of this package and of all nested packages, pre-order.
     *
     * @return all components in the subtree
     */
    public List<Component> allComponents() {
        List<Component> result = new ArrayList<>(components);
        for (ArPackage subPackage : subPackages) {
            result.addAll(subPackage.allComponents());
        }
        return result;
    }

    /**
     * Returns all packages in the subtree including this one, pre-order.
     *
     * @return this package followed by its descendants
     */
    public List<ArPackage> allPackages() {
        List<ArPackage> result = new ArrayList<>();
        result.add(this);
        for (ArPackage subPackage : subPackages) {
            result.addAll(subPackage.allPackages());
        }
        return result;
    }

    /**
     * Finds a component by short name in this package or, failing that, in nested packages.
     *
     * @param name component short name
     * @return first match in pre-order
     */
    public Optional<Component> findComponent(String name) {
        for (Component component : components) {
            if (component.shortName().equals(name)) {
                return Optional.of(component);
            }
        }
        for (ArPackage subPackage : subPackages) {
            Optional<Component> found = subPackage.findComponent(name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Mutable builder used while the package tree is being walked.
     */
    public static class Builder {
        private final String uuid = UUID.randomUUID().toString();
        private final String shortName;
        private final String fullPath;
        private final String description;
        private final List<Component.Builder> components = new ArrayList<>();
        private final List<PortInterface> interfaces = new ArrayList<>();
        private final List<Builder> subPackages = new ArrayList<>();

        /**
         * Creates a builder below the given parent path.
         *
         * @param shortName package short name
         * @param parentPath full path of the parent, empty for root packages
         * @param description optional description
         */
        public Builder(String shortName, String parentPath, String description) {
            this.shortName = shortName == null ? "" : shortName;
            this.fullPath = (parentPath == null ? "" : parentPath) + "/" + this.shortName;
            this.description = description;
        }

        public String fullPath() {
            return fullPath;
        }

        public Builder addComponent(Component.Builder component) {
            components.add(Objects.requireNonNull(component, "component must not be null"));
            return this;
        }

        public Builder addInterface(PortInterface portInterface) {
            interfaces.add(Objects.requireNonNull(portInterface, "portInterface must not be null"));
            return this;
        }

        public Builder addSubPackage(Builder subPackage) {
            subPackages.add(Objects.requireNonNull(subPackage, "subPackage must not be null"));
            return this;
        }

        public ArPackage build() {
            return new ArPackage(
                uuid,
                shortName,
                fullPath,
                description,
                components.stream().map(Component.Builder::build).toList(),
                interfaces,
                subPackages.stream().map(Builder::build).toList()
            );
        }
    }
}
