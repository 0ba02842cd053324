package com.board.core.service.document;

/**
 * Text container of a board document.
 */
public interface SharedText {

    int length();

    void insert(int index, String text);

    void delete(int index, int length);

    @Override
    String toString();
}
