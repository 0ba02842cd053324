package com.board.core.service.document;

import java.util.Map;
import java.util.Set;

/**
 * Ordered key/value container of a board document.
 *
 * Values are scalars, {@link SharedMap} or {@link SharedArray}.
 */
public interface SharedMap {

    void set(String key, Object value);

    Object get(String key);

    void delete(String key);

    Set<String> keys();

    int size();

    /**
     * Plain-value copy with nested containers converted recursively.
     */
    Map<String, Object> toJson();
}
