package org.graphsearch.graph.id;

/**
 * Closed set of node identifiers used by the reference graph catalog.
 *
 * <p>Implementations are value records, so identity is structural. {@link #toString()}
 * renders the literal form accepted back by the command-line parser.</p>
 */
public interface NodeId {

    /**
     * @return identifier shape discriminator.
     */
    Kind kind();

    /**
     * Creates a string-named identifier.
     */
    static NodeId named(String name) {
        return new NamedNode(name);
    }

    /**
     * Creates an integer identifier.
     */
    static NodeId of(int value) {
        return new IntegerNode(value);
    }

    /**
     * Creates a row/column grid identifier.
     */
    static NodeId grid(int row, int col) {
        return new GridNode(row, col);
    }

    /**
     * Identifier shapes.
     */
    enum Kind {
        NAMED,
        INTEGER,
        GRID
    }
}
