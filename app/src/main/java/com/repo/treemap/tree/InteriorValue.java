package com.repo.treemap.tree;

import java.util.List;

/**
 * Value that records attributed directly to a node which also has children.
 * {@code structuralPath} is the visible structural ancestor that carries it when drawn.
 */
public record InteriorValue(List<String> originalPath, List<String> structuralPath, double value) {

    public InteriorValue {
        originalPath = List.copyOf(originalPath);
        structuralPath = List.copyOf(structuralPath);
    }
}
