package com.board.core.service.graph;

/**
 * Thrown when the store rejects a statement (syntax, constraint violation, ...).
 */
public class GraphQueryException extends GraphStoreException {

    public static final String ERROR_CODE = "GRAPH_QUERY_FAILED";

    public GraphQueryException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
