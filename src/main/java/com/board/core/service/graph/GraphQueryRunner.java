package com.board.core.service.graph;

import java.util.List;
import java.util.Map;

/**
 * Executes a single Cypher statement against the graph store.
 *
 * Every record is materialized as a map of named fields holding plain Java
 * values (strings, longs, doubles, booleans, lists and maps).
 */
public interface GraphQueryRunner {

    /**
     * Runs a statement and returns all of its records.
     *
     * @param cypher the statement text
     * @param parameters named parameters referenced by the statement
     * @return the records, empty when the statement returns nothing
     * @throws GraphConnectivityException if the store cannot be reached
     * @throws GraphQueryException if the statement is rejected by the store
     */
    List<Map<String, Object>> run(String cypher, Map<String, Object> parameters);

    default List<Map<String, Object>> run(String cypher) {
        return run(cypher, Map.of());
    }
}
