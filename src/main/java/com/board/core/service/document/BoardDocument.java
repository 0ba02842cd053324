package com.board.core.service.document;

/**
 * Replicated board document: an item array, a connection array and the
 * board-type text.
 *
 * Implementations apply {@link #transact(Runnable)} and {@link #load(Runnable)}
 * atomically, so no reader ever observes a partially applied batch.
 */
public interface BoardDocument {

    String ITEMS = "canvasItems";
    String CONNECTIONS = "connections";
    String BOARD_TYPE = "boardType";

    SharedArray getItems();

    SharedArray getConnections();

    SharedText getBoardType();

    /**
     * Creates a detached map to be inserted into this document.
     */
    SharedMap createMap();

    /**
     * Creates a detached array to be inserted into this document.
     */
    SharedArray createArray();

    /**
     * Applies a client edit as one atomic batch. The document becomes
     * {@link DocumentLifecycle#DIVERGED}.
     */
    void transact(Runnable changes);

    /**
     * Applies a load from the store as one atomic batch, but only while the
     * document is still {@link DocumentLifecycle#UNINITIALIZED}. On success
     * the document becomes {@link DocumentLifecycle#LOADED}. If the batch
     * throws, the document keeps its lifecycle.
     *
     * @return true if the batch was applied
     */
    boolean load(Runnable changes);

    DocumentLifecycle getLifecycle();

    /**
     * Reads the current state as plain values.
     */
    DocumentSnapshot snapshot();

    /**
     * Registers a listener notified after every client edit.
     */
    void addUpdateListener(Runnable listener);
}
