package com.board.core.service.document;

import java.util.List;
import java.util.Map;

/**
 * Materialized state of a board document at one point in time.
 *
 * @param items item records in document order
 * @param connections connection records in document order
 * @param boardType the board-type text, empty when never set
 */
public record DocumentSnapshot(
        List<Map<String, Object>> items,
        List<Map<String, Object>> connections,
        String boardType
) {

    public DocumentSnapshot {
        items = items == null ? List.of() : items;
        connections = connections == null ? List.of() : connections;
        boardType = boardType == null ? "" : boardType;
    }

    public static DocumentSnapshot empty() {
        return new DocumentSnapshot(List.of(), List.of(), "");
    }
}
