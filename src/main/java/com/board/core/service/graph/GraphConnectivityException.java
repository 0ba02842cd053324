package com.board.core.service.graph;

/**
 * Thrown when the graph store cannot be reached.
 */
public class GraphConnectivityException extends GraphStoreException {

    public static final String ERROR_CODE = "GRAPH_UNAVAILABLE";

    public GraphConnectivityException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
