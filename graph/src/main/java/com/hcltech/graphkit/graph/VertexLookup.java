package com.hcltech.graphkit.graph;

import com.hcltech.graphkit.common.errorsor.ErrorsOr;

import java.util.Arrays;
import java.util.Locale;

/** How a graph finds its vertices. Chosen once, when the graph is created. */
public enum VertexLookup {
    /** Equality scan. Works for any vertex type. */
    LINEAR {
        @Override
        public <V> VertexRegistry<V> newRegistry() {
            return new LinearVertexRegistry<>();
        }
    },
    /** Hash index. Vertex type must implement hashCode consistently with equals. */
    HASHED {
        @Override
        public <V> VertexRegistry<V> newRegistry() {
            return new HashedVertexRegistry<>();
        }
    };

    public abstract <V> VertexRegistry<V> newRegistry();

    /** Case-insensitive lookup by name, e.g. from a properties file. Never throws. */
    public static ErrorsOr<VertexLookup> parse(String name) {
        if (name == null || name.isBlank()) return ErrorsOr.error("Vertex lookup name is empty");
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (VertexLookup lookup : values()) {
            if (lookup.name().equals(upper)) return ErrorsOr.lift(lookup);
        }
        return ErrorsOr.error("Unknown vertex lookup '" + name + "'; expected one of " + Arrays.toString(values()));
    }
}
