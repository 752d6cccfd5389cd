package org.mides.delivery.model;

import org.mides.delivery.exception.UnknownLocationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/* A missing edge weighs infinity */
public final class WeightedGraph {

    private final Map<String, Map<String, Double>> adjacency;

    private WeightedGraph(Map<String, Map<String, Double>> adjacency) {
        this.adjacency = adjacency;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public int size() {
        return adjacency.size();
    }

    public boolean contains(String node) {
        return adjacency.containsKey(node);
    }

    public void requireNode(String node) {
        if (!contains(node))
            throw new UnknownLocationException(node);
    }

    public Map<String, Double> neighbors(String node) {
        return adjacency.getOrDefault(node, Map.of());
    }

    public boolean hasEdge(String from, String to) {
        return neighbors(from).containsKey(to);
    }

    public double weight(String from, String to) {
        return neighbors(from).getOrDefault(to, Double.POSITIVE_INFINITY);
    }

    /* Factor is evaluated once per source node */
    public WeightedGraph scaleOutgoing(ToDoubleFunction<String> factorBySource) {
        var builder = builder();
        for (var entry : adjacency.entrySet()) {
            var source = entry.getKey();
            builder.addNode(source);
            double factor = factorBySource.applyAsDouble(source);
            entry.getValue().forEach((target, weight) -> builder.addEdge(source, target, weight * factor));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightedGraph)) return false;
        return adjacency.equals(((WeightedGraph) o).adjacency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(adjacency);
    }

    @Override
    public String toString() {
        return "WeightedGraph" + adjacency;
    }

    public static final class Builder {
        private final Map<String, Map<String, Double>> adjacency = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder addNode(String node) {
            Objects.requireNonNull(node, "node");
            adjacency.computeIfAbsent(node, key -> new LinkedHashMap<>());
            return this;
        }

        public Builder addEdge(String from, String to, double weight) {
            if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0)
                throw new IllegalArgumentException(
                    String.format("Edge %s -> %s must have a finite non-negative weight, got %s", from, to, weight)
                );
            if (Objects.equals(from, to))
                throw new IllegalArgumentException(String.format("Self loop on %s is not allowed", from));

            addNode(from);
            addNode(to);
            adjacency.get(from).put(to, weight);
            return this;
        }

        public Builder addUndirectedEdge(String a, String b, double weight) {
            addEdge(a, b, weight);
            return addEdge(b, a, weight);
        }

        public WeightedGraph build() {
            var copy = new LinkedHashMap<String, Map<String, Double>>();
            adjacency.forEach((node, edges) -> copy.put(node, Collections.unmodifiableMap(new LinkedHashMap<>(edges))));
            return new WeightedGraph(Collections.unmodifiableMap(copy));
        }
    }
}
