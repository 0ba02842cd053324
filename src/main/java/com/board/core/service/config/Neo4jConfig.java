package com.board.core.service.config;

import com.board.core.service.graph.GraphClient;
import com.board.core.service.graph.Neo4jGraphClient;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Neo4j driver configuration.
 *
 * The driver is created once for the process and closed with the context.
 * Components receive the {@link GraphClient} instead of the driver.
 */
@Slf4j
@Configuration
public class Neo4jConfig {

    @Value("${board.neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${board.neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${board.neo4j.password:password}")
    private String neo4jPassword;

    @Value("${board.neo4j.database:}")
    private String neo4jDatabase;

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver() {
        log.info("Creating Neo4j driver for {}", neo4jUri);
        return GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
    }

    @Bean
    public GraphClient graphClient(Driver neo4jDriver) {
        return new Neo4jGraphClient(neo4jDriver, neo4jDatabase);
    }
}
