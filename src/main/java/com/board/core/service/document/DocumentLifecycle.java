package com.board.core.service.document;

/**
 * Readiness of a board document with respect to the graph store.
 */
public enum DocumentLifecycle {

    /** Created, nothing loaded from the store yet. */
    UNINITIALIZED,

    /** Populated from the store (or confirmed new) and not edited since. */
    LOADED,

    /** Edited by a client after creation or load. The store must not overwrite it. */
    DIVERGED
}
