package com.board.core.service.session;

import java.util.Optional;

/**
 * Interface for the save queue.
 *
 * Turns a stream of document changes into a bounded rate of write cycles:
 * requests are delayed by a debounce window and at most one request per
 * board is pending at any time.
 */
public interface SaveQueue {

    /**
     * Requests a save for a board. A request for a board that already has
     * one pending is merged into it.
     *
     * @param boardId the board to save
     * @return true if the board now has a pending save, false if the queue is full
     */
    boolean enqueue(String boardId);

    /**
     * Waits for the next due save request.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the request if one became due, empty otherwise
     */
    Optional<SaveRequest> dequeue(long timeoutMs);

    /**
     * Gets the number of boards with a pending save.
     *
     * @return number of pending requests
     */
    int size();

    /**
     * Gets the queue capacity.
     *
     * @return maximum number of pending requests
     */
    int getCapacity();

    /**
     * Gets the queue utilization as a percentage.
     *
     * @return utilization percentage (0-100)
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }

    /**
     * Checks if the queue is at capacity.
     *
     * @return true if full
     */
    default boolean isFull() {
        return size() >= getCapacity();
    }

    /**
     * Drops all pending requests.
     */
    void clear();
}
