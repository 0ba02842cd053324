package com.board.core.service.graph;

/**
 * A store session scoped to one bind or write call.
 *
 * Statements run directly on the session auto-commit one by one.
 * Sessions are never pooled by callers; close them on every exit path.
 */
public interface GraphSession extends GraphQueryRunner, AutoCloseable {

    /**
     * Opens an explicit transaction on this session.
     */
    GraphTransaction beginTransaction();

    @Override
    void close();
}
