package com.board.core.service.persistence;

import java.math.BigInteger;

/**
 * Identity helpers shared by the binder and the synchronizer.
 *
 * The store returns integral numbers as {@code Long}, while documents may hold
 * {@code Integer}; ids are normalized before they are compared.
 */
final class GraphIds {

    private GraphIds() {
    }

    static Object normalize(Object id) {
        if (id instanceof Integer || id instanceof Short || id instanceof Byte) {
            return ((Number) id).longValue();
        }
        if (id instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        return id;
    }

    static boolean isPresent(Object id) {
        return id != null && !(id instanceof String text && text.isBlank());
    }
}
