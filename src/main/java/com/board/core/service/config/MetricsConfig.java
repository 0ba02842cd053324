package com.board.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for Board Core Service.
 *
 * Provides custom metrics for bind, write and save operations.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter bindsCompleted;
    private final Counter bindFailures;
    private final Counter writesCompleted;
    private final Counter writeFailures;
    private final Counter itemsDeleted;
    private final Counter connectionsDeleted;
    private final Counter savesCoalesced;

    // Timers
    private final Timer bindTimer;
    private final Timer writeTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.bindsCompleted = Counter.builder("board.bind.count")
                .description("Number of boards loaded into documents")
                .register(registry);

        this.bindFailures = Counter.builder("board.bind.failures")
                .description("Number of board loads that failed")
                .register(registry);

        this.writesCompleted = Counter.builder("board.write.count")
                .description("Number of write cycles completed")
                .register(registry);

        this.writeFailures = Counter.builder("board.write.failures")
                .description("Number of write cycles aborted by an error")
                .register(registry);

        this.itemsDeleted = Counter.builder("board.write.items.deleted")
                .description("Number of item nodes deleted by write cycles")
                .register(registry);

        this.connectionsDeleted = Counter.builder("board.write.connections.deleted")
                .description("Number of connections deleted by write cycles")
                .register(registry);

        this.savesCoalesced = Counter.builder("board.save.coalesced")
                .description("Number of save requests merged into a pending one")
                .register(registry);

        this.bindTimer = Timer.builder("board.bind.duration")
                .description("Time taken to load a board into a document")
                .register(registry);

        this.writeTimer = Timer.builder("board.write.duration")
                .description("Time taken by a write cycle")
                .register(registry);
    }

    /**
     * Registers a gauge.
     *
     * @param name the metric name
     * @param description the metric description
     * @param valueSupplier supplier for the current value
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
                .description(description)
                .register(registry);
    }
}
