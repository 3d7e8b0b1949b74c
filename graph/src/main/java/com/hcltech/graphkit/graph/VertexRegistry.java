package com.hcltech.graphkit.graph;

import java.util.List;

/**
 * Ordered, duplicate-free set of vertices. Insertion order is the iteration and display order,
 * and a vertex's position in that order is its index.
 * <p>
 * Implementations differ only in how {@link #indexOf} finds a vertex; they must agree on
 * every observable result.
 */
public interface VertexRegistry<V> {

    /** Index of {@code v} in insertion order, or -1 if it is not registered. */
    int indexOf(V v);

    /** Appends {@code v} unless an equal vertex is already registered. */
    boolean add(V v);

    int size();

    /** Independent copy in insertion order. */
    List<V> snapshot();

    default boolean contains(V v) {
        return indexOf(v) >= 0;
    }
}
