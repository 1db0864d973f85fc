package org.graphsearch.search;

/**
 * A* frontier entry ordered by {@code f = g + h}.
 *
 * <p>Equal priorities pop in push order.</p>
 */
record FrontierEntry<N>(
        N node,
        double priority,
        long sequence
) implements Comparable<FrontierEntry<N>> {
    @Override
    public int compareTo(FrontierEntry<N> other) {
        int byPriority = Double.compare(this.priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
