package com.board.core.service.session;

import com.board.core.service.config.MetricsConfig;
import com.board.core.service.config.SaveConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of SaveQueue using a DelayQueue.
 *
 * A request keeps the due time of the first change that created it, so a
 * board under constant editing is still saved once per debounce window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultSaveQueue implements SaveQueue {

    private final SaveConfig config;
    private final MetricsConfig metricsConfig;

    private final DelayQueue<SaveRequest> queue = new DelayQueue<>();
    private final Map<String, SaveRequest> pending = new ConcurrentHashMap<>();
    private int capacity;
    private long debounceMs;

    @PostConstruct
    void init() {
        this.capacity = config.getQueue().getCapacity();
        this.debounceMs = config.getQueue().getDebounceMs();

        metricsConfig.registerGauge(
                "board.save.queue.size",
                "Boards waiting for a save",
                this::size
        );
        metricsConfig.registerGauge(
                "board.save.queue.utilization",
                "Save queue utilization percentage",
                this::getUtilizationPercent
        );

        log.info("SaveQueue initialized with capacity: {}, debounce: {}ms", capacity, debounceMs);
    }

    @Override
    public synchronized boolean enqueue(String boardId) {
        if (pending.containsKey(boardId)) {
            metricsConfig.getSavesCoalesced().increment();
            log.debug("Save for board {} already pending", boardId);
            return true;
        }
        if (pending.size() >= capacity) {
            log.warn("Save queue full, rejecting save for board: {}", boardId);
            return false;
        }

        var request = SaveRequest.delayed(boardId, debounceMs);
        pending.put(boardId, request);
        queue.add(request);
        log.debug("Enqueued save for board: {}", boardId);
        return true;
    }

    @Override
    public Optional<SaveRequest> dequeue(long timeoutMs) {
        try {
            SaveRequest request = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (request != null) {
                pending.remove(request.boardId(), request);
                log.debug("Dequeued save for board: {}", request.boardId());
            }
            return Optional.ofNullable(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while dequeuing save request");
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return pending.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public synchronized void clear() {
        queue.clear();
        pending.clear();
        log.info("Save queue cleared");
    }
}
