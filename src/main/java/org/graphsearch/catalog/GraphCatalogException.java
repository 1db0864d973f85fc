package org.graphsearch.catalog;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a catalog lookup or catalog assembly contract fails.
 */
@Getter
@Accessors(fluent = true)
public final class GraphCatalogException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public GraphCatalogException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] " + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }
}
