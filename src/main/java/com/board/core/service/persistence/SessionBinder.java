package com.board.core.service.persistence;

import com.board.core.service.config.BoardConfig;
import com.board.core.service.config.MetricsConfig;
import com.board.core.service.document.BoardDocument;
import com.board.core.service.document.SharedArray;
import com.board.core.service.document.SharedMap;
import com.board.core.service.document.SharedText;
import com.board.core.service.graph.CypherStatements;
import com.board.core.service.graph.GraphClient;
import com.board.core.service.graph.GraphQueryRunner;
import com.board.core.service.graph.GraphSession;
import com.board.core.service.graph.NodeLabel;
import com.board.core.service.graph.RelationshipTypes;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Populates a board document from the graph store.
 *
 * Binding is best effort: failures are logged and counted, never thrown, and
 * the document is left as it was found. A document that is no longer
 * uninitialized, or that already holds items or connections, is never
 * overwritten.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionBinder {

    private static final String ID = "id";
    private static final String TYPE = "type";
    private static final String BOARD_ID = "boardId";
    private static final String PARENT = "parent";
    private static final String PRODUCES_EVENT_ID = "producesEventId";

    private final GraphClient graphClient;
    private final PropertySanitizer sanitizer;
    private final BoardConfig boardConfig;
    private final MetricsConfig metricsConfig;

    /**
     * Loads the board into the document, creating the Board node when the board is new.
     *
     * @param boardId the board identifier
     * @param document the document to populate
     */
    public void bind(String boardId, BoardDocument document) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try (GraphSession session = graphClient.openSession()) {
            executeBind(session, boardId, document);
            metricsConfig.getBindsCompleted().increment();
        } catch (RuntimeException e) {
            metricsConfig.getBindFailures().increment();
            log.error("Failed to load board {} from graph store", boardId, e);
        } finally {
            sample.stop(metricsConfig.getBindTimer());
        }
    }

    // ==================== Private Methods ====================

    private void executeBind(GraphSession session, String boardId, BoardDocument document) {
        var board = session.run(CypherStatements.FIND_BOARD, Map.of(ID, boardId));
        if (board.isEmpty()) {
            createBoard(session, boardId, document);
            return;
        }

        String boardType = boardTypeOf(board.get(0));
        var items = readItems(session, boardId);
        var connections = readConnections(session, boardId, items);
        applyParents(session, boardId, items);

        boolean applied = document.load(() -> populate(document, boardType, items.values(), connections));
        if (applied) {
            log.info("Loaded board {} ({}): {} items, {} connections",
                    boardId, boardType, items.size(), connections.size());
        } else {
            log.info("Board {} document already populated, load skipped", boardId);
        }
    }

    private void createBoard(GraphSession session, String boardId, BoardDocument document) {
        session.run(CypherStatements.CREATE_BOARD, Map.of(ID, boardId, TYPE, boardConfig.getDefaultBoardType()));
        // Nothing to populate, but the document is now in step with the store.
        document.load(() -> { });
        log.info("Created new board {} with type {}", boardId, boardConfig.getDefaultBoardType());
    }

    private String boardTypeOf(Map<String, Object> row) {
        Object properties = row.get("board");
        if (properties instanceof Map<?, ?> map && map.get(TYPE) instanceof String type && !type.isEmpty()) {
            return type;
        }
        return boardConfig.getDefaultBoardType();
    }

    // ==================== Reconstruction ====================

    private Map<Object, Map<String, Object>> readItems(GraphQueryRunner runner, String boardId) {
        var items = new LinkedHashMap<Object, Map<String, Object>>();
        for (var row : runner.run(CypherStatements.BOARD_ITEMS, Map.of(ID, boardId))) {
            var item = sanitizer.restore(propertiesOf(row));
            item.remove(BOARD_ID);
            item.put(TYPE, itemType(row.get("labels"), item.get(TYPE)));
            items.put(GraphIds.normalize(item.get(ID)), item);
        }
        return items;
    }

    private String itemType(Object labels, Object storedType) {
        var label = labelOf(labels);
        if (label == NodeLabel.UNKNOWN && storedType instanceof String type && !type.isBlank()) {
            return type;
        }
        return label.labelName();
    }

    private NodeLabel labelOf(Object labels) {
        if (labels instanceof List<?> names) {
            for (Object name : names) {
                var label = NodeLabel.fromLabelName(String.valueOf(name));
                if (label.isPresent() && label.get().isItemLabel()) {
                    return label.get();
                }
            }
        }
        return NodeLabel.UNKNOWN;
    }

    private List<Map<String, Object>> readConnections(GraphQueryRunner runner, String boardId,
                                                      Map<Object, Map<String, Object>> items) {
        var connections = new ArrayList<Map<String, Object>>();
        var parameters = Map.<String, Object>of(ID, boardId, "reserved", RelationshipTypes.RESERVED);
        for (var row : runner.run(CypherStatements.BOARD_CONNECTIONS, parameters)) {
            var properties = propertiesOf(row);
            if (isDerivedTrigger(row, properties)) {
                var source = items.get(GraphIds.normalize(row.get("from")));
                if (source != null) {
                    source.put(PRODUCES_EVENT_ID, row.get("to"));
                }
                continue;
            }
            var connection = sanitizer.restore(properties);
            connection.put("from", row.get("from"));
            connection.put("to", row.get("to"));
            connection.put(TYPE, row.get(TYPE));
            connections.add(connection);
        }
        return connections;
    }

    private boolean isDerivedTrigger(Map<String, Object> row, Map<String, Object> properties) {
        return RelationshipTypes.TRIGGERS.equals(row.get(TYPE)) && properties.get(ID) == null;
    }

    private void applyParents(GraphQueryRunner runner, String boardId, Map<Object, Map<String, Object>> items) {
        for (var row : runner.run(CypherStatements.BOARD_ITEM_PARENTS, Map.of(ID, boardId))) {
            var child = items.get(GraphIds.normalize(row.get("childId")));
            if (child != null) {
                child.put(PARENT, row.get("parentId"));
            }
        }
    }

    private static Map<String, Object> propertiesOf(Map<String, Object> row) {
        var properties = new HashMap<String, Object>();
        if (row.get("props") instanceof Map<?, ?> map) {
            map.forEach((key, value) -> properties.put(String.valueOf(key), value));
        }
        return properties;
    }

    // ==================== Document population ====================

    private void populate(BoardDocument document, String boardType,
                          Iterable<Map<String, Object>> items, List<Map<String, Object>> connections) {
        SharedArray itemArray = document.getItems();
        SharedArray connectionArray = document.getConnections();
        if (itemArray.length() > 0 || connectionArray.length() > 0) {
            log.warn("Document already holds {} items and {} connections, not overwriting",
                    itemArray.length(), connectionArray.length());
            return;
        }

        SharedText text = document.getBoardType();
        text.delete(0, text.length());
        text.insert(0, boardType);
        items.forEach(item -> itemArray.push(toMap(document, item)));
        connections.forEach(connection -> connectionArray.push(toMap(document, connection)));
    }

    private SharedMap toMap(BoardDocument document, Map<?, ?> values) {
        SharedMap map = document.createMap();
        values.forEach((key, value) -> map.set(String.valueOf(key), toDocumentValue(document, value)));
        return map;
    }

    private Object toDocumentValue(BoardDocument document, Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return toMap(document, map);
        }
        if (value instanceof List<?> list) {
            SharedArray array = document.createArray();
            list.forEach(element -> array.push(toDocumentValue(document, element)));
            return array;
        }
        return String.valueOf(value);
    }
}
