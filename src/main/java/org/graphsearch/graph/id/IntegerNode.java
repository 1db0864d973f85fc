package org.graphsearch.graph.id;

/**
 * Integer-labelled node, e.g. binary-tree heap index.
 *
 * @param value label value.
 */
public record IntegerNode(int value) implements NodeId {

    @Override
    public Kind kind() {
        return Kind.INTEGER;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
