package com.board.core.service.api.health;

import com.board.core.service.config.SaveConfig;
import com.board.core.service.session.BoardSessionRegistry;
import com.board.core.service.session.SaveQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the save pipeline.
 *
 * Goes DOWN once pending saves pass the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class SaveQueueHealthIndicator implements HealthIndicator {

    private final SaveQueue queue;
    private final SaveConfig config;
    private final BoardSessionRegistry registry;

    @Override
    public Health health() {
        int utilization = queue.getUtilizationPercent();
        int threshold = config.getQueue().getBackpressureThreshold();

        Health.Builder builder = utilization >= threshold
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("pendingSaves", queue.size())
                .withDetail("queueCapacity", queue.getCapacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .withDetail("liveBoards", registry.getLiveCount())
                .build();
    }
}
