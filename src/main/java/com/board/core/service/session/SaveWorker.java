package com.board.core.service.session;

import com.board.core.service.config.SaveConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker service that turns due save requests into write cycles.
 *
 * Workers spend most of their time blocked on the queue. Two workers may
 * pick up different boards at once; writes for the same board are serialized
 * by the registry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SaveWorker {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final SaveQueue queue;
    private final BoardSessionRegistry registry;
    private final SaveConfig saveConfig;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final AtomicInteger threadCounter = new AtomicInteger(0);

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        int workerCount = saveConfig.getWorker().getThreadCount();
        executorService = Executors.newFixedThreadPool(workerCount, this::createWorkerThread);
        running.set(true);
        startWorkers(workerCount);
        log.info("SaveWorker started with {} workers", workerCount);
    }

    @PreDestroy
    void stop() {
        running.set(false);
        shutdownExecutor();
        log.info("SaveWorker stopped. Final active workers: {}", activeWorkers.get());
    }

    // ==================== Executor Management ====================

    private Thread createWorkerThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("save-worker-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    private void startWorkers(int workerCount) {
        for (int i = 0; i < workerCount; i++) {
            executorService.submit(this::processLoop);
        }
    }

    private void shutdownExecutor() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of save workers");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        activeWorkers.incrementAndGet();
        var pollTimeoutMs = saveConfig.getWorker().getPollMs();

        try {
            while (running.get()) {
                processNextRequest(pollTimeoutMs);
            }
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    private void processNextRequest(long pollTimeoutMs) {
        try {
            queue.dequeue(pollTimeoutMs)
                    .ifPresent(this::save);
        } catch (Exception e) {
            log.error("Error in save worker loop", e);
        }
    }

    private void save(SaveRequest request) {
        log.debug("Saving board {} requested at {}", request.boardId(), request.createdAt());
        registry.flush(request.boardId());
    }

    // ==================== Monitoring ====================

    /**
     * Returns the current number of active workers.
     */
    public int getActiveWorkerCount() {
        return activeWorkers.get();
    }
}
