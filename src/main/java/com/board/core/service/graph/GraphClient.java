package com.board.core.service.graph;

/**
 * Handle to the graph store, injected into every component that talks to it.
 *
 * The hosting process owns the lifecycle of the underlying connection pool.
 */
public interface GraphClient {

    /**
     * Opens a new session. The caller must close it.
     */
    GraphSession openSession();

    /**
     * Verifies that the store is reachable.
     *
     * @throws GraphConnectivityException if it is not
     */
    void verifyConnectivity();
}
