package com.board.core.service.document;

import java.util.List;

/**
 * Ordered sequence container of a board document.
 */
public interface SharedArray {

    int length();

    Object get(int index);

    void push(Object value);

    void insert(int index, Object value);

    void delete(int index, int count);

    /**
     * Plain-value copy with nested containers converted recursively.
     */
    List<Object> toJson();
}
