package com.board.core.service.schema;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Applies the graph schema while the application context starts.
 *
 * A failure propagates out of initialization and stops the application:
 * the service does not run against a store it could not verify.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "board.features", name = "schema-bootstrap-enabled", havingValue = "true", matchIfMissing = true)
public class SchemaBootstrap {

    private final SchemaManager schemaManager;

    @PostConstruct
    void bootstrap() {
        log.info("Applying graph schema");
        schemaManager.apply();
    }
}
