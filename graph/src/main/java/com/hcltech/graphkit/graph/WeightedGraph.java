package com.hcltech.graphkit.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Mutable directed weighted graph. Vertices and edges are only ever added, never removed.
 * <p>
 * Expected failures are return values: {@code false} from the add methods, an empty
 * {@link Optional} from {@link #getWeight}, an empty collection from the neighbour queries.
 * Null vertices, weights and sinks are programming errors and throw {@link NullPointerException}.
 * <p>
 * The adjacency map is keyed by registry index rather than by vertex, so with
 * {@link VertexLookup#LINEAR} nothing here relies on {@code V.hashCode()}.
 * <p>
 * Not thread safe.
 */
public final class WeightedGraph<V, W> {
    private static final Logger log = LoggerFactory.getLogger(WeightedGraph.class);

    private final VertexRegistry<V> vertices;
    private final Map<Integer, List<EdgeRecord<V, W>>> adjacency = new LinkedHashMap<>();
    private final Comparator<? super V> vertexOrder;

    WeightedGraph(VertexRegistry<V> vertices, Comparator<? super V> vertexOrder) {
        this.vertices = Objects.requireNonNull(vertices, "vertices");
        this.vertexOrder = Objects.requireNonNull(vertexOrder, "vertexOrder");
    }

    // --- factories ---

    /**
     * Linear lookup, neighbours in natural order.
     * The natural order should be consistent with {@code equals}: {@link #neighbors} keeps one of any two
     * destinations that compare as 0 (e.g. {@code BigDecimal} 1.0 and 1.00), although both remain separate edges.
     */
    public static <V extends Comparable<? super V>, W> WeightedGraph<V, W> natural() {
        return natural(VertexLookup.LINEAR);
    }

    public static <V extends Comparable<? super V>, W> WeightedGraph<V, W> natural(VertexLookup lookup) {
        return new WeightedGraph<>(lookup.newRegistry(), Comparator.<V>naturalOrder());
    }

    /**
     * Linear lookup, neighbours ordered by {@code order}, which should be consistent with {@code equals}
     * for the same reason as in {@link #natural()}.
     */
    public static <V, W> WeightedGraph<V, W> ordered(Comparator<? super V> order) {
        return ordered(order, VertexLookup.LINEAR);
    }

    public static <V, W> WeightedGraph<V, W> ordered(Comparator<? super V> order, VertexLookup lookup) {
        return new WeightedGraph<>(lookup.newRegistry(), order);
    }

    // --- vertices ---

    /** Returns false, changing nothing, if an equal vertex is already present. */
    public boolean addVertex(V v) {
        boolean added = vertices.add(v);
        if (!added) log.debug("Vertex {} already present", v);
        return added;
    }

    public int numVertices() {
        return vertices.size();
    }

    /** Copy of the vertices in insertion order. */
    public List<V> getVertices() {
        return vertices.snapshot();
    }

    boolean hasVertex(V v) {
        return vertices.contains(v);
    }

    private int lookupVertex(V v) {
        return vertices.indexOf(v);
    }

    // --- edges ---

    /**
     * Adds {@code from -> to}, or overwrites its weight if that edge already exists.
     * Returns false, changing nothing, if either endpoint is not a vertex of this graph.
     */
    public boolean addEdge(V from, V to, W weight) {
        Objects.requireNonNull(weight, "weight");
        int fromIndex = lookupVertex(from);
        int toIndex = lookupVertex(to);
        if (fromIndex < 0 || toIndex < 0) {
            log.debug("Rejected edge ({},{},{}): unknown vertex", from, to, weight);
            return false;
        }
        List<EdgeRecord<V, W>> records = adjacency.computeIfAbsent(fromIndex, i -> new ArrayList<>());
        EdgeRecord<V, W> existing = find(records, to);
        if (existing != null) {
            existing.weight = weight;
        } else {
            records.add(new EdgeRecord<>(to, weight));
        }
        return true;
    }

    /** Recounted on every call. */
    public int numEdges() {
        int count = 0;
        for (List<EdgeRecord<V, W>> records : adjacency.values()) count += records.size();
        return count;
    }

    /** Weight of {@code from -> to}; empty if either vertex is unknown or there is no such edge. */
    public Optional<W> getWeight(V from, V to) {
        int fromIndex = lookupVertex(from);
        if (fromIndex < 0 || lookupVertex(to) < 0) return Optional.empty();
        EdgeRecord<V, W> existing = find(recordsOf(fromIndex), to);
        return existing == null ? Optional.empty() : Optional.of(existing.weight);
    }

    /** Copy of the edges leaving {@code v}, in the order they were first added. */
    public List<Edge<V, W>> outgoingEdges(V v) {
        int index = lookupVertex(v);
        if (index < 0) return new ArrayList<>();
        List<Edge<V, W>> result = new ArrayList<>();
        for (EdgeRecord<V, W> r : recordsOf(index)) result.add(r.toEdge(v));
        return result;
    }

    /** Copy of every edge, grouped by source in adjacency order. */
    public List<Edge<V, W>> edges() {
        List<Edge<V, W>> result = new ArrayList<>();
        List<V> all = vertices.snapshot();
        for (var entry : adjacency.entrySet()) {
            V source = all.get(entry.getKey());
            for (EdgeRecord<V, W> r : entry.getValue()) result.add(r.toEdge(source));
        }
        return result;
    }

    // --- neighbours ---

    /**
     * Vertices one edge away from {@code v}, ordered by this graph's vertex order (not insertion order).
     * Empty if {@code v} is unknown.
     */
    public NavigableSet<V> neighbors(V v) {
        NavigableSet<V> result = new TreeSet<>(vertexOrder);
        int index = lookupVertex(v);
        if (index < 0) return result;
        for (EdgeRecord<V, W> r : recordsOf(index)) result.add(r.destination);
        return result;
    }

    // --- debug ---

    /**
     * Writes one line per source with outgoing edges: {@code A: (A,B,5) (A,C,2)}.
     * For humans only; the format may change.
     */
    public void dump(Appendable sink) {
        Objects.requireNonNull(sink, "sink");
        try {
            List<V> all = vertices.snapshot();
            for (var entry : adjacency.entrySet()) {
                V source = all.get(entry.getKey());
                sink.append(String.valueOf(source)).append(':');
                for (EdgeRecord<V, W> r : entry.getValue()) {
                    sink.append(' ').append(r.toEdge(source).toString());
                }
                sink.append('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to dump graph", e);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        dump(sb);
        return sb.toString();
    }

    // --- internals ---

    private List<EdgeRecord<V, W>> recordsOf(int sourceIndex) {
        return adjacency.getOrDefault(sourceIndex, List.of());
    }

    private static <V, W> EdgeRecord<V, W> find(List<EdgeRecord<V, W>> records, V to) {
        for (EdgeRecord<V, W> r : records) {
            if (r.destination.equals(to)) return r;
        }
        return null;
    }
}
