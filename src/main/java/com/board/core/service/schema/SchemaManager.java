package com.board.core.service.schema;

import com.board.core.service.graph.CypherStatements;
import com.board.core.service.graph.GraphClient;
import com.board.core.service.graph.GraphSession;
import com.board.core.service.graph.NodeLabel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares the constraints and indexes of the board graph.
 *
 * Every statement is guarded with {@code IF NOT EXISTS}, so applying the
 * schema to a store that already has some or all of it is a no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaManager {

    private static final List<String> ITEM_INDEXED_PROPERTIES = List.of("boardId", "instanceName");

    private final GraphClient graphClient;

    /**
     * Verifies connectivity, then declares the schema.
     *
     * @throws com.board.core.service.graph.GraphStoreException if the store is
     *         unreachable or rejects a statement
     */
    public void apply() {
        graphClient.verifyConnectivity();

        var statements = schemaStatements();
        try (GraphSession session = graphClient.openSession()) {
            statements.forEach(session::run);
        }
        log.info("Graph schema applied: {} statements", statements.size());
    }

    /**
     * All schema statements in execution order: constraints first, then indexes.
     */
    public List<String> schemaStatements() {
        var statements = new ArrayList<String>();
        for (NodeLabel label : NodeLabel.values()) {
            statements.add(CypherStatements.uniqueIdConstraint(label));
        }

        statements.add(CypherStatements.propertyIndex(NodeLabel.BOARD, "type"));
        for (NodeLabel label : NodeLabel.itemLabels()) {
            ITEM_INDEXED_PROPERTIES.forEach(property ->
                    statements.add(CypherStatements.propertyIndex(label, property)));
            if (label.isNameIndexed()) {
                statements.add(CypherStatements.propertyIndex(label, "name"));
            }
        }
        return statements;
    }
}
