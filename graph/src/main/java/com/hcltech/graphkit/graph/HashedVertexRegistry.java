package com.hcltech.graphkit.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Same ordered list as {@link LinearVertexRegistry}, plus a vertex -> index map for O(1) lookups.
 * V must have an equals/hashCode pair that agree with each other.
 */
public final class HashedVertexRegistry<V> implements VertexRegistry<V> {
    private final List<V> vertices = new ArrayList<>();
    private final Map<V, Integer> index = new HashMap<>();

    @Override
    public int indexOf(V v) {
        Objects.requireNonNull(v, "vertex");
        Integer i = index.get(v);
        return i == null ? -1 : i;
    }

    @Override
    public boolean add(V v) {
        Objects.requireNonNull(v, "vertex");
        Integer prev = index.putIfAbsent(v, vertices.size());
        if (prev != null) return false;
        vertices.add(v);
        return true;
    }

    @Override
    public int size() {
        return vertices.size();
    }

    @Override
    public List<V> snapshot() {
        return new ArrayList<>(vertices);
    }
}
