package com.hcltech.graphkit.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Equality scan over an ArrayList. O(n) lookups; needs nothing from V except equals. */
public final class LinearVertexRegistry<V> implements VertexRegistry<V> {
    private final List<V> vertices = new ArrayList<>();

    @Override
    public int indexOf(V v) {
        Objects.requireNonNull(v, "vertex");
        for (int i = 0; i < vertices.size(); i++) {
            if (vertices.get(i).equals(v)) return i;
        }
        return -1;
    }

    @Override
    public boolean add(V v) {
        if (indexOf(v) >= 0) return false;
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
