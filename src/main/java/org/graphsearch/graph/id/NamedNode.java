package org.graphsearch.graph.id;

import java.util.Objects;

/**
 * Opaque string-labelled node, e.g. {@code Gate} or {@code L3}.
 *
 * @param name non-blank label.
 */
public record NamedNode(String name) implements NodeId {

    public NamedNode {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must be non-blank");
        }
    }

    @Override
    public Kind kind() {
        return Kind.NAMED;
    }

    @Override
    public String toString() {
        return name;
    }
}
