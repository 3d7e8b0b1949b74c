package com.hcltech.graphkit.graph;

import java.util.Objects;

/** One directed weighted edge, as reported to callers. Renders as the dump triple. */
public record Edge<V, W>(V from, V to, W weight) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(weight, "weight");
    }

    @Override
    public String toString() {
        return "(" + from + "," + to + "," + weight + ")";
    }
}
