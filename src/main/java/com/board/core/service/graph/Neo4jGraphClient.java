package com.board.core.service.graph;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * GraphClient backed by the official Neo4j Java driver.
 *
 * The driver (and its connection pool) is owned by the Spring context;
 * this client only opens sessions on it.
 */
@Slf4j
@RequiredArgsConstructor
public class Neo4jGraphClient implements GraphClient {

    private final Driver driver;
    private final String database;

    @Override
    public GraphSession openSession() {
        return new Neo4jGraphSession(translate("open session", () -> driver.session(sessionConfig())));
    }

    @Override
    public void verifyConnectivity() {
        translate("verify connectivity", () -> {
            driver.verifyConnectivity();
            return null;
        });
    }

    // ==================== Helpers ====================

    private SessionConfig sessionConfig() {
        if (database == null || database.isBlank()) {
            return SessionConfig.defaultConfig();
        }
        return SessionConfig.forDatabase(database);
    }

    private static List<Map<String, Object>> collect(List<Record> records) {
        return records.stream()
                .map(Record::asMap)
                .toList();
    }

    static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            throw new GraphConnectivityException("Graph store unavailable during " + operation, e);
        } catch (Neo4jException e) {
            throw new GraphQueryException("Graph store rejected " + operation + ": " + e.getMessage(), e);
        }
    }

    private static String describe(String cypher) {
        String flat = cypher.replaceAll("\\s+", " ").trim();
        return flat.length() > 80 ? "statement '" + flat.substring(0, 80) + "...'" : "statement '" + flat + "'";
    }

    // ==================== Session / Transaction ====================

    private static final class Neo4jGraphSession implements GraphSession {

        private final Session session;

        private Neo4jGraphSession(Session session) {
            this.session = session;
        }

        @Override
        public List<Map<String, Object>> run(String cypher, Map<String, Object> parameters) {
            log.debug("Running {}", describe(cypher));
            return translate(describe(cypher), () -> collect(session.run(cypher, parameters).list()));
        }

        @Override
        public GraphTransaction beginTransaction() {
            return new Neo4jGraphTransaction(translate("begin transaction", session::beginTransaction));
        }

        @Override
        public void close() {
            translate("close session", () -> {
                session.close();
                return null;
            });
        }
    }

    private static final class Neo4jGraphTransaction implements GraphTransaction {

        private final Transaction transaction;

        private Neo4jGraphTransaction(Transaction transaction) {
            this.transaction = transaction;
        }

        @Override
        public List<Map<String, Object>> run(String cypher, Map<String, Object> parameters) {
            log.debug("Running {} in transaction", describe(cypher));
            return translate(describe(cypher), () -> collect(transaction.run(cypher, parameters).list()));
        }

        @Override
        public void commit() {
            translate("commit", () -> {
                transaction.commit();
                return null;
            });
        }

        @Override
        public void close() {
            translate("close transaction", () -> {
                transaction.close();
                return null;
            });
        }
    }
}
