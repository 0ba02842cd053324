package com.board.core.service.session;

import java.time.Instant;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * A pending save for one board, due once its debounce delay has elapsed.
 *
 * @param boardId the board to save
 * @param dueAtNanos {@link System#nanoTime()} value at which the save becomes due
 * @param createdAt when the request was first made
 */
public record SaveRequest(
        String boardId,
        long dueAtNanos,
        Instant createdAt
) implements Delayed {

    public static SaveRequest delayed(String boardId, long delayMs) {
        return new SaveRequest(boardId, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs), Instant.now());
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(dueAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
        if (other instanceof SaveRequest request) {
            return Long.compare(dueAtNanos, request.dueAtNanos);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
    }
}
