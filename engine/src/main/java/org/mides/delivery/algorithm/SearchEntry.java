package org.mides.delivery.algorithm;

/* Ties on priority go by node name */
final class SearchEntry implements Comparable<SearchEntry> {
    final double priority;
    final double cost;
    final String node;

    SearchEntry(double priority, double cost, String node) {
        this.priority = priority;
        this.cost = cost;
        this.node = node;
    }

    @Override
    public int compareTo(SearchEntry other) {
        int byPriority = Double.compare(priority, other.priority);
        return byPriority != 0 ? byPriority : node.compareTo(other.node);
    }
}
