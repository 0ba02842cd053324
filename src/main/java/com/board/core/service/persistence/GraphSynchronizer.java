package com.board.core.service.persistence;

import com.board.core.service.config.BoardConfig;
import com.board.core.service.config.MetricsConfig;
import com.board.core.service.document.DocumentSnapshot;
import com.board.core.service.graph.CypherStatements;
import com.board.core.service.graph.GraphClient;
import com.board.core.service.graph.GraphQueryRunner;
import com.board.core.service.graph.GraphSession;
import com.board.core.service.graph.GraphTransaction;
import com.board.core.service.graph.NodeLabel;
import com.board.core.service.graph.RelationshipTypes;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes the graph state of a board match a document snapshot.
 *
 * <p>One write cycle:
 * <ol>
 *   <li>upsert the Board node and its type</li>
 *   <li>detach-delete item nodes no longer in the snapshot</li>
 *   <li>merge every item node, its board membership and its derived edges</li>
 *   <li>delete connections no longer in the snapshot</li>
 *   <li>merge every connection</li>
 * </ol>
 *
 * <p>A cycle over an unchanged snapshot changes nothing. A failure aborts the
 * rest of the cycle. {@link #write} logs it; {@link #writeOrFail} rethrows it.
 * Callers must not run two cycles for the same board concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphSynchronizer {

    /** Item fields projected into edges instead of node properties. */
    static final Set<String> STRUCTURAL_KEYS =
            Set.of("parent", "children", "connectedPolicies", "producesEventId", "linkedDiagram");

    /** Connection fields carried by the relationship itself. */
    static final Set<String> CONNECTION_KEYS = Set.of("id", "from", "to", "type");

    private final GraphClient graphClient;
    private final PropertySanitizer sanitizer;
    private final BoardConfig boardConfig;
    private final MetricsConfig metricsConfig;

    /**
     * Runs one write cycle for the board. Failures are logged and counted, never thrown.
     *
     * @param boardId the board identifier
     * @param snapshot the document state to persist
     */
    public void write(String boardId, DocumentSnapshot snapshot) {
        try {
            writeOrFail(boardId, snapshot);
        } catch (RuntimeException e) {
            log.error("Failed to persist board {} to graph store", boardId, e);
        }
    }

    /**
     * Runs one write cycle for the board and rethrows any failure after counting it.
     *
     * @param boardId the board identifier
     * @param snapshot the document state to persist
     */
    public void writeOrFail(String boardId, DocumentSnapshot snapshot) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var plan = WritePlan.of(snapshot, boardConfig.getDefaultBoardType());
            executeWrite(boardId, plan);
            metricsConfig.getWritesCompleted().increment();
        } catch (RuntimeException e) {
            metricsConfig.getWriteFailures().increment();
            throw e;
        } finally {
            sample.stop(metricsConfig.getWriteTimer());
        }
    }

    // ==================== Cycle ====================

    private void executeWrite(String boardId, WritePlan plan) {
        long startTime = System.currentTimeMillis();
        WriteCounts counts;

        try (GraphSession session = graphClient.openSession()) {
            if (isTransactional()) {
                try (GraphTransaction transaction = session.beginTransaction()) {
                    counts = applyCycle(transaction, boardId, plan);
                    transaction.commit();
                }
            } else {
                counts = applyCycle(session, boardId, plan);
            }
        }

        metricsConfig.getItemsDeleted().increment(counts.itemsDeleted);
        metricsConfig.getConnectionsDeleted().increment(counts.connectionsDeleted);
        log.info("Persisted board {}: {} items, {} connections ({} items, {} connections deleted) in {}ms",
                boardId, plan.items.size(), plan.connections.size(),
                counts.itemsDeleted, counts.connectionsDeleted, System.currentTimeMillis() - startTime);
    }

    private boolean isTransactional() {
        return boardConfig.getFeatures().isTransactionalWrites();
    }

    private WriteCounts applyCycle(GraphQueryRunner runner, String boardId, WritePlan plan) {
        var counts = new WriteCounts();
        runner.run(CypherStatements.UPSERT_BOARD, params("id", boardId, "type", plan.boardType));

        counts.itemsDeleted = deleteStaleItems(runner, boardId, plan.items.keySet());
        plan.items.forEach((id, item) -> writeItem(runner, boardId, id, item));

        counts.connectionsDeleted = deleteStaleConnections(runner, boardId, plan.connections.keySet());
        plan.connections.forEach((id, connection) -> writeConnection(runner, id, connection));
        return counts;
    }

    // ==================== Items ====================

    private int deleteStaleItems(GraphQueryRunner runner, String boardId, Set<Object> keep) {
        var stale = staleIds(runner.run(CypherStatements.BOARD_ITEM_IDS, params("id", boardId)), keep);
        if (!stale.isEmpty()) {
            log.debug("Deleting {} stale items from board {}", stale.size(), boardId);
            runner.run(CypherStatements.DELETE_BOARD_ITEMS, params("id", boardId, "ids", stale));
        }
        return stale.size();
    }

    private void writeItem(GraphQueryRunner runner, String boardId, Object id, Map<String, Object> item) {
        var label = NodeLabel.forItemType(item.get("type"));
        var properties = new LinkedHashMap<String, Object>(item);
        properties.keySet().removeAll(STRUCTURAL_KEYS);

        runner.run(CypherStatements.mergeItem(label),
                params("id", id, "boardId", boardId, "props", sanitizer.sanitize(properties)));

        Object parent = item.get("parent");
        runner.run(CypherStatements.PRUNE_PARENTS, params("boardId", boardId, "childId", id, "parentId", parent));
        if (parent != null) {
            runner.run(CypherStatements.MERGE_PARENT, params("childId", id, "parentId", parent));
        }

        Object producesEventId = item.get("producesEventId");
        runner.run(CypherStatements.PRUNE_TRIGGERS,
                params("boardId", boardId, "sourceId", id, "targetId", producesEventId));
        if (producesEventId != null) {
            runner.run(CypherStatements.MERGE_TRIGGERS, params("sourceId", id, "targetId", producesEventId));
        }
    }

    // ==================== Connections ====================

    private int deleteStaleConnections(GraphQueryRunner runner, String boardId, Set<Object> keep) {
        var reserved = RelationshipTypes.RESERVED;
        var stale = staleIds(
                runner.run(CypherStatements.BOARD_CONNECTION_IDS, params("id", boardId, "reserved", reserved)), keep);
        if (!stale.isEmpty()) {
            log.debug("Deleting {} stale connections from board {}", stale.size(), boardId);
            runner.run(CypherStatements.DELETE_BOARD_CONNECTIONS,
                    params("id", boardId, "reserved", reserved, "ids", stale));
        }
        return stale.size();
    }

    private void writeConnection(GraphQueryRunner runner, Object id, Map<String, Object> connection) {
        String type = RelationshipTypes.derive(connection.get("type"));
        Object from = connection.get("from");
        Object to = connection.get("to");

        var properties = new LinkedHashMap<String, Object>(connection);
        properties.keySet().removeAll(CONNECTION_KEYS);

        runner.run(CypherStatements.mergeConnection(type),
                params("id", id, "from", from, "to", to, "props", sanitizer.sanitize(properties)));
    }

    // ==================== Helpers ====================

    private static List<Object> staleIds(List<Map<String, Object>> rows, Set<Object> keep) {
        var stale = new LinkedHashSet<Object>();
        for (var row : rows) {
            Object id = GraphIds.normalize(row.get("id"));
            if (id != null && !keep.contains(id)) {
                stale.add(id);
            }
        }
        return new ArrayList<>(stale);
    }

    /**
     * Statement parameters; unlike {@link Map#of} this accepts null values.
     */
    private static Map<String, Object> params(Object... keysAndValues) {
        var parameters = new HashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            parameters.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return parameters;
    }

    // ==================== Inner Classes ====================

    /**
     * Snapshot records keyed by normalized id. Later records replace earlier ones.
     */
    private static final class WritePlan {
        final String boardType;
        final Map<Object, Map<String, Object>> items = new LinkedHashMap<>();
        final Map<Object, Map<String, Object>> connections = new LinkedHashMap<>();

        private WritePlan(String boardType) {
            this.boardType = boardType;
        }

        static WritePlan of(DocumentSnapshot snapshot, String defaultBoardType) {
            String boardType = snapshot.boardType().isBlank() ? defaultBoardType : snapshot.boardType();
            var plan = new WritePlan(boardType);

            for (var item : snapshot.items()) {
                Object id = item.get("id");
                if (!GraphIds.isPresent(id)) {
                    log.warn("Skipping item without id: {}", item.get("type"));
                    continue;
                }
                plan.items.put(GraphIds.normalize(id), item);
            }

            for (var connection : snapshot.connections()) {
                Object id = connection.get("id");
                if (!GraphIds.isPresent(id)) {
                    log.warn("Skipping connection without id: {} -> {}", connection.get("from"), connection.get("to"));
                    continue;
                }
                if (connection.get("from") == null || connection.get("to") == null) {
                    log.warn("Skipping connection {} without both endpoints", id);
                    continue;
                }
                plan.connections.put(GraphIds.normalize(id), connection);
            }
            return plan;
        }
    }

    /**
     * Mutable counters for one cycle.
     */
    private static class WriteCounts {
        int itemsDeleted = 0;
        int connectionsDeleted = 0;
    }
}
