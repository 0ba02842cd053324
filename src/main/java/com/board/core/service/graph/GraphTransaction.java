package com.board.core.service.graph;

/**
 * Multi-statement transaction. Closing it without {@link #commit()} rolls it back.
 */
public interface GraphTransaction extends GraphQueryRunner, AutoCloseable {

    void commit();

    @Override
    void close();
}
