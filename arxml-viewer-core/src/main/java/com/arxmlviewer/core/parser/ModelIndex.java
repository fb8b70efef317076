package com.arxmlviewer.core.parser;

import com.arxmlviewer.core.model.Component;
import com.arxmlviewer.core.model.PortInterface;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup tables built during the first pass and consulted during the second.
 *
 * <p>References are matched by full AUTOSAR path first. When no path matches,
 * the last path segment is tried as a short name, but only if exactly one
 * entity carries that name.
 */
class ModelIndex {

    private final List<Component.Builder> components = new ArrayList<>();
    private final Map<String, Component.Builder> componentsByUuid = new HashMap<>();
    private final Map<String, Component.Builder> componentsByPath = new LinkedHashMap<>();
    private final Map<String, List<Component.Builder>> componentsByName = new HashMap<>();
    private final Map<String, PortInterface> interfacesByPath = new LinkedHashMap<>();
    private final Map<String, List<PortInterface>> interfacesByName = new HashMap<>();

    void registerComponent(Component.Builder component) {
        components.add(component);
        componentsByUuid.put(component.uuid(), component);
        componentsByPath.putIfAbsent(component.fullPath(), component);
        componentsByName.computeIfAbsent(component.shortName(), key -> new ArrayList<>()).add(component);
    }

    void registerInterface(PortInterface portInterface) {
        interfacesByPath.putIfAbsent(portInterface.fullPath(), portInterface);
        interfacesByName.computeIfAbsent(portInterface.shortName(), key -> new ArrayList<>()).add(portInterface);
    }

    /**
     * Returns all registered components in registration order.
     *
     * @return component builders
     */
    List<Component.Builder> components() {
        return List.copyOf(components);
    }

    Optional<Component.Builder> componentByUuid(String uuid) {
        return uuid == null ? Optional.empty() : Optional.ofNullable(componentsByUuid.get(uuid));
    }

    Optional<Component.Builder> findComponent(String reference) {
        return find(reference, componentsByPath, componentsByName);
    }

    Optional<PortInterface> findInterface(String reference) {
        return find(reference, interfacesByPath, interfacesByName);
    }

    private static <T> Optional<T> find(String reference, Map<String, T> byPath, Map<String, List<T>> byName) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String path = normalize(reference);
        T exact = byPath.get(path);
        if (exact != null) {
            return Optional.of(exact);
        }
        List<T> candidates = byName.getOrDefault(lastSegment(path), List.of());
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    /**
     * Returns the last segment of an AUTOSAR reference path.
     *
     * @param reference path such as {@code /Pkg/Comp/Port}
     * @return {@code Port}, or an empty string for a blank reference
     */
    static String lastSegment(String reference) {
        if (reference == null) {
            return "";
        }
        String path = reference.trim();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String normalize(String reference) {
        String path = reference.trim();
        return path.startsWith("/") ? path : "/" + path;
    }
}
