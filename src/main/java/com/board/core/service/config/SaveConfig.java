package com.board.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the save pipeline.
 *
 * Controls queue size, debounce delay, worker pool and backpressure threshold.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "board.save")
public class SaveConfig {

    /**
     * Queue configuration.
     */
    private QueueConfig queue = new QueueConfig();

    /**
     * Worker configuration.
     */
    private WorkerConfig worker = new WorkerConfig();

    @Getter
    @Setter
    public static class QueueConfig {

        /**
         * Maximum number of boards waiting for a save.
         */
        private int capacity = 1000;

        /**
         * Queue utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;

        /**
         * Delay between a save request and the write, in milliseconds.
         * Further requests for the same board inside this window are coalesced.
         */
        private long debounceMs = 2000;
    }

    @Getter
    @Setter
    public static class WorkerConfig {

        /**
         * Number of worker threads.
         */
        private int threadCount = 2;

        /**
         * Poll timeout in milliseconds.
         */
        private long pollMs = 100;
    }
}
