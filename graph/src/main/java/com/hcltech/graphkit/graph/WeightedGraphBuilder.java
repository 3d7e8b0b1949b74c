package com.hcltech.graphkit.graph;

import com.hcltech.graphkit.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public final class WeightedGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(WeightedGraphBuilder.class);

    private WeightedGraphBuilder() {}

    /**
     * Adds all vertices, then all edges, to {@code target}. Returns the graph if everything was accepted,
     * otherwise one message per rejected vertex or edge. Never throws for bad data.
     * <p>
     * Accepted items stay in {@code target} even when others were rejected.
     */
    public static <V, W> ErrorsOr<WeightedGraph<V, W>> build(WeightedGraph<V, W> target,
                                                            Collection<V> vertices,
                                                            Collection<Edge<V, W>> edges) {
        Objects.requireNonNull(target);
        Objects.requireNonNull(vertices);
        Objects.requireNonNull(edges);

        List<String> errors = new ArrayList<>();
        for (V v : vertices) {
            if (!target.addVertex(v)) errors.add("Duplicate vertex " + v);
        }

        int rejectedEdges = 0;
        for (Edge<V, W> e : edges) {
            if (target.addEdge(e.from(), e.to(), e.weight())) continue;
            rejectedEdges++;
            Set<String> missing = new LinkedHashSet<>();
            if (!target.hasVertex(e.from())) missing.add(String.valueOf(e.from()));
            if (!target.hasVertex(e.to())) missing.add(String.valueOf(e.to()));
            errors.add("Edge " + e + " references unknown vertex " + String.join(" and ", missing));
        }

        if (!errors.isEmpty()) {
            log.debug("Rejected {} vertex(es) and {} edge(s) while building graph",
                    errors.size() - rejectedEdges, rejectedEdges);
        }
        return ErrorsOr.errorsOrLift(errors, () -> target);
    }

    /** As {@link #build}, into a fresh natural-order graph with linear lookup. */
    public static <V extends Comparable<? super V>, W> ErrorsOr<WeightedGraph<V, W>> naturalGraph(
            Collection<V> vertices, Collection<Edge<V, W>> edges) {
        return build(WeightedGraph.natural(), vertices, edges);
    }
}
