package com.hcltech.graphkit.graph;

/** Adjacency list entry. The weight is overwritten in place when an edge is re-added. */
final class EdgeRecord<V, W> {
    final V destination;
    W weight;

    EdgeRecord(V destination, W weight) {
        this.destination = destination;
        this.weight = weight;
    }

    Edge<V, W> toEdge(V source) {
        return new Edge<>(source, destination, weight);
    }
}
