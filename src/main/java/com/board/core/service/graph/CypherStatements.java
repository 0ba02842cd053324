package com.board.core.service.graph;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cypher statement templates for the board graph.
 *
 * Values always travel as parameters. The only text spliced into a template
 * is a {@link NodeLabel} name or a relationship type that passed
 * {@link RelationshipTypes#isSafe(String)}.
 */
public final class CypherStatements {

    // ==================== Load ====================

    public static final String FIND_BOARD = """
            MATCH (b:Board {id: $id}) \
            RETURN properties(b) AS board""";

    public static final String CREATE_BOARD = """
            MERGE (b:Board {id: $id}) \
            ON CREATE SET b.name = $id, b.path = $id, b.type = $type""";

    public static final String BOARD_ITEMS = """
            MATCH (b:Board {id: $id})-[:CONTAINS]->(n) \
            RETURN properties(n) AS props, labels(n) AS labels""";

    public static final String BOARD_CONNECTIONS = """
            MATCH (b:Board {id: $id})-[:CONTAINS]->(source) \
            MATCH (b)-[:CONTAINS]->(target) \
            MATCH (source)-[r]->(target) \
            WHERE NOT type(r) IN $reserved \
            RETURN properties(r) AS props, source.id AS from, target.id AS to, type(r) AS type""";

    public static final String BOARD_ITEM_PARENTS = """
            MATCH (b:Board {id: $id})-[:CONTAINS]->(child) \
            MATCH (parent)-[:CONTAINS]->(child) \
            WHERE NOT parent:Board \
            RETURN child.id AS childId, parent.id AS parentId""";

    // ==================== Write: board and items ====================

    public static final String UPSERT_BOARD = """
            MERGE (b:Board {id: $id}) \
            ON CREATE SET b.name = $id, b.path = $id \
            SET b.type = $type""";

    public static final String BOARD_ITEM_IDS = """
            MATCH (b:Board {id: $id})-[:CONTAINS]->(n) \
            RETURN n.id AS id""";

    public static final String DELETE_BOARD_ITEMS = """
            MATCH (b:Board {id: $id})-[:CONTAINS]->(n) \
            WHERE n.id IN $ids \
            DETACH DELETE n""";

    public static final String MERGE_PARENT = """
            MATCH (child {id: $childId}), (parent {id: $parentId}) \
            MERGE (parent)-[:CONTAINS]->(child)""";

    public static final String PRUNE_PARENTS = """
            MATCH (b:Board {id: $boardId})-[:CONTAINS]->(child {id: $childId}) \
            MATCH (parent)-[r:CONTAINS]->(child) \
            WHERE NOT parent:Board AND ($parentId IS NULL OR parent.id <> $parentId) \
            DELETE r""";

    public static final String MERGE_TRIGGERS = """
            MATCH (source {id: $sourceId}), (target {id: $targetId}) \
            MERGE (source)-[:TRIGGERS]->(target)""";

    public static final String PRUNE_TRIGGERS = """
            MATCH (b:Board {id: $boardId})-[:CONTAINS]->(source {id: $sourceId}) \
            MATCH (source)-[r:TRIGGERS]->(target) \
            WHERE r.id IS NULL AND ($targetId IS NULL OR target.id <> $targetId) \
            DELETE r""";

    // ==================== Write: connections ====================

    public static final String BOARD_CONNECTION_IDS = """
            MATCH (b:Board {id: $id})-[:CONTAINS]->(s)-[r]->(e) \
            WHERE NOT type(r) IN $reserved \
            RETURN r.id AS id""";

    public static final String DELETE_BOARD_CONNECTIONS = """
            MATCH (b:Board {id: $id})-[:CONTAINS]->(s)-[r]->(e) \
            WHERE NOT type(r) IN $reserved AND r.id IN $ids \
            DELETE r""";

    // ==================== Templates ====================

    private static final String MERGE_ITEM_TEMPLATE = """
            MERGE (n:`%s` {id: $id}) \
            SET n += $props, n.boardId = $boardId \
            WITH n \
            MERGE (b:Board {id: $boardId}) \
            MERGE (b)-[:CONTAINS]->(n)""";

    private static final String MERGE_CONNECTION_TEMPLATE = """
            MATCH (a {id: $from}), (b {id: $to}) \
            MERGE (a)-[r:`%s`]->(b) \
            SET r.id = $id, r += $props""";

    private static final String CONSTRAINT_TEMPLATE =
            "CREATE CONSTRAINT %s IF NOT EXISTS FOR (n:`%s`) REQUIRE n.id IS UNIQUE";

    private static final String INDEX_TEMPLATE =
            "CREATE INDEX %s IF NOT EXISTS FOR (n:`%s`) ON (n.%s)";

    private static final Map<NodeLabel, String> MERGE_ITEM = new EnumMap<>(NodeLabel.class);
    private static final Map<String, String> MERGE_CONNECTION = new ConcurrentHashMap<>();

    static {
        for (NodeLabel label : NodeLabel.itemLabels()) {
            MERGE_ITEM.put(label, MERGE_ITEM_TEMPLATE.formatted(label.labelName()));
        }
    }

    private CypherStatements() {
    }

    /**
     * Merge statement for an item node under the given label.
     */
    public static String mergeItem(NodeLabel label) {
        String statement = MERGE_ITEM.get(label);
        if (statement == null) {
            throw new IllegalArgumentException("Not an item label: " + label);
        }
        return statement;
    }

    /**
     * Merge statement for a connection of the given relationship type.
     */
    public static String mergeConnection(String relationshipType) {
        if (!RelationshipTypes.isSafe(relationshipType)) {
            throw new IllegalArgumentException("Unsafe relationship type: " + relationshipType);
        }
        return MERGE_CONNECTION.computeIfAbsent(relationshipType,
                type -> MERGE_CONNECTION_TEMPLATE.formatted(type));
    }

    public static String uniqueIdConstraint(NodeLabel label) {
        return CONSTRAINT_TEMPLATE.formatted(schemaName(label, "id_unique"), label.labelName());
    }

    public static String propertyIndex(NodeLabel label, String property) {
        return INDEX_TEMPLATE.formatted(schemaName(label, property.toLowerCase(Locale.ROOT) + "_idx"), label.labelName(), property);
    }

    private static String schemaName(NodeLabel label, String suffix) {
        return label.labelName().toLowerCase(Locale.ROOT) + "_" + suffix;
    }
}
