package com.arxmlviewer.core.parser;

import com.arxmlviewer.core.model.ArPackage;
import com.arxmlviewer.core.model.Component;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Package forest and metadata produced by one {@link ArxmlParser#parseFile} call.
 *
 * @param packages root packages in document order
 * @param metadata statistics and diagnostics
 */
public record ParseResult(
    List<ArPackage> packages,
    ParseMetadata metadata
) {
    public ParseResult {
        Objects.requireNonNull(metadata, "metadata must not be null");
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    /**
     * Returns every component in the forest, pre-order.
     *
     * @return all components
     */
    public List<Component> allComponents() {
        return packages.stream()
            .flatMap(pkg -> pkg.allComponents().stream())
            .toList();
    }

    /**
     * Returns true if the document held no packages. This is a valid outcome, not a failure.
     *
     * @return true for an empty forest
     */
    @JsonIgnore
    public boolean isEmpty() {
        return packages.isEmpty();
    }
}
