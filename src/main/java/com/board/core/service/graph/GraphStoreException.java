package com.board.core.service.graph;

/**
 * Base exception for graph store failures.
 */
public class GraphStoreException extends RuntimeException {

    private final String errorCode;

    public GraphStoreException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
