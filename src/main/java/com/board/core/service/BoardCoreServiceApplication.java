package com.board.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Board Core Service Application - Entry point for the Spring Boot application.
 *
 * This application keeps collaborative board documents in step with a Neo4j
 * property graph. It:
 * - Declares the graph schema at startup
 * - Loads a board into a live document when its first client connects
 * - Writes debounced document changes back to the graph
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.board.core.service.config")
public class BoardCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoardCoreServiceApplication.class, args);
    }
}
