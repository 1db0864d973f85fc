package org.graphsearch.graph.id;

/**
 * Grid cell node addressed by row and column.
 *
 * @param row zero-based row.
 * @param col zero-based column.
 */
public record GridNode(int row, int col) implements NodeId {

    @Override
    public Kind kind() {
        return Kind.GRID;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
