package com.board.core.service.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Relationship type names used by the board graph.
 */
@Slf4j
public final class RelationshipTypes {

    /** Board-to-item membership and item-to-item hierarchy. */
    public static final String CONTAINS = "CONTAINS";

    /** Item-to-board detail view linkage. */
    public static final String HAS_DETAIL_VIEW = "HAS_DETAIL_VIEW";

    /** Domain trigger edge derived from an item's {@code producesEventId}. */
    public static final String TRIGGERS = "TRIGGERS";

    /** Type used for connections that carry no type of their own. */
    public static final String RELATED_TO = "RELATED_TO";

    /** Structural types never treated as board connections. */
    public static final List<String> RESERVED = List.of(CONTAINS, HAS_DETAIL_VIEW);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SAFE_TYPE = Pattern.compile("[\\p{L}\\p{N}_]+");

    private RelationshipTypes() {
    }

    /**
     * Derives the relationship type for a connection's free-text type:
     * upper-cased, whitespace runs replaced by underscores.
     *
     * @return the derived type, or {@link #RELATED_TO} when the input is absent
     *         or blank, names a reserved type, or would produce anything but
     *         letters, digits and underscores
     */
    public static String derive(Object connectionType) {
        if (!(connectionType instanceof String text) || text.isBlank()) {
            return RELATED_TO;
        }
        String derived = WHITESPACE.matcher(text.toUpperCase(Locale.ROOT)).replaceAll("_");
        if (!isSafe(derived) || RESERVED.contains(derived)) {
            log.warn("Connection type '{}' cannot be used as a relationship type, storing as {}", text, RELATED_TO);
            return RELATED_TO;
        }
        return derived;
    }

    /**
     * Whether a type name can be placed between backticks in a statement.
     */
    public static boolean isSafe(String type) {
        return type != null && SAFE_TYPE.matcher(type).matches();
    }
}
