package com.board.core.service.document;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-process BoardDocument.
 *
 * One lock guards the whole document, so a batch is invisible to readers
 * until it completes. Containers only accept scalars, null and containers
 * created by the same document; plain maps and lists are rejected.
 */
@Slf4j
public class InMemoryBoardDocument implements BoardDocument {

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Runnable> updateListeners = new CopyOnWriteArrayList<>();

    private final ArrayImpl items = new ArrayImpl();
    private final ArrayImpl connections = new ArrayImpl();
    private final TextImpl boardType = new TextImpl();

    private DocumentLifecycle lifecycle = DocumentLifecycle.UNINITIALIZED;
    private int batchDepth = 0;
    private boolean loading = false;

    public InMemoryBoardDocument(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    // ==================== BoardDocument ====================

    @Override
    public SharedArray getItems() {
        return items;
    }

    @Override
    public SharedArray getConnections() {
        return connections;
    }

    @Override
    public SharedText getBoardType() {
        return boardType;
    }

    @Override
    public SharedMap createMap() {
        return new MapImpl();
    }

    @Override
    public SharedArray createArray() {
        return new ArrayImpl();
    }

    @Override
    public void transact(Runnable changes) {
        lock.lock();
        try {
            batchDepth++;
            try {
                changes.run();
            } finally {
                batchDepth--;
            }
            if (!loading) {
                lifecycle = DocumentLifecycle.DIVERGED;
            }
        } finally {
            lock.unlock();
        }
        if (!lock.isHeldByCurrentThread()) {
            notifyUpdate();
        }
    }

    @Override
    public boolean load(Runnable changes) {
        lock.lock();
        try {
            if (lifecycle != DocumentLifecycle.UNINITIALIZED) {
                log.debug("Document '{}' already {}, load skipped", name, lifecycle);
                return false;
            }
            loading = true;
            batchDepth++;
            try {
                changes.run();
            } finally {
                batchDepth--;
                loading = false;
            }
            lifecycle = DocumentLifecycle.LOADED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DocumentLifecycle getLifecycle() {
        return read(() -> lifecycle);
    }

    @Override
    public DocumentSnapshot snapshot() {
        return read(() -> new DocumentSnapshot(
                recordsOf(items),
                recordsOf(connections),
                boardType.toString()
        ));
    }

    @Override
    public void addUpdateListener(Runnable listener) {
        updateListeners.add(listener);
    }

    // ==================== Internals ====================

    private <T> T read(Supplier<T> reader) {
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a single container mutation. Outside a batch it counts as a client edit.
     */
    private void mutate(Runnable mutation) {
        boolean standalone;
        lock.lock();
        try {
            standalone = batchDepth == 0;
            mutation.run();
            if (standalone) {
                lifecycle = DocumentLifecycle.DIVERGED;
            }
        } finally {
            lock.unlock();
        }
        if (standalone && !lock.isHeldByCurrentThread()) {
            notifyUpdate();
        }
    }

    private void notifyUpdate() {
        for (Runnable listener : updateListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Update listener failed for document '{}'", name, e);
            }
        }
    }

    private static List<Map<String, Object>> recordsOf(ArrayImpl array) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Object value : array.values) {
            if (value instanceof MapImpl map) {
                records.add(map.toJson());
            }
        }
        return records;
    }

    private Object checkValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof MapImpl map && map.owner() == this) {
            return value;
        }
        if (value instanceof ArrayImpl array && array.owner() == this) {
            return value;
        }
        throw new IllegalArgumentException("Unsupported document value of type "
                + value.getClass().getName() + "; use createMap()/createArray() for nested values");
    }

    private static Object toJsonValue(Object value) {
        if (value instanceof SharedMap map) {
            return map.toJson();
        }
        if (value instanceof SharedArray array) {
            return array.toJson();
        }
        return value;
    }

    // ==================== Containers ====================

    private final class MapImpl implements SharedMap {

        private final Map<String, Object> entries = new LinkedHashMap<>();

        private InMemoryBoardDocument owner() {
            return InMemoryBoardDocument.this;
        }

        @Override
        public void set(String key, Object value) {
            Object checked = checkValue(value);
            mutate(() -> entries.put(key, checked));
        }

        @Override
        public Object get(String key) {
            return read(() -> entries.get(key));
        }

        @Override
        public void delete(String key) {
            mutate(() -> entries.remove(key));
        }

        @Override
        public Set<String> keys() {
            return read(() -> new LinkedHashSet<>(entries.keySet()));
        }

        @Override
        public int size() {
            return read(entries::size);
        }

        @Override
        public Map<String, Object> toJson() {
            return read(() -> {
                Map<String, Object> json = new LinkedHashMap<>();
                entries.forEach((key, value) -> json.put(key, toJsonValue(value)));
                return json;
            });
        }
    }

    private final class ArrayImpl implements SharedArray {

        private final List<Object> values = new ArrayList<>();

        private InMemoryBoardDocument owner() {
            return InMemoryBoardDocument.this;
        }

        @Override
        public int length() {
            return read(values::size);
        }

        @Override
        public Object get(int index) {
            return read(() -> values.get(index));
        }

        @Override
        public void push(Object value) {
            Object checked = checkValue(value);
            mutate(() -> values.add(checked));
        }

        @Override
        public void insert(int index, Object value) {
            Object checked = checkValue(value);
            mutate(() -> values.add(index, checked));
        }

        @Override
        public void delete(int index, int count) {
            mutate(() -> values.subList(index, index + count).clear());
        }

        @Override
        public List<Object> toJson() {
            return read(() -> {
                List<Object> json = new ArrayList<>(values.size());
                values.forEach(value -> json.add(toJsonValue(value)));
                return json;
            });
        }
    }

    private final class TextImpl implements SharedText {

        private final StringBuilder text = new StringBuilder();

        @Override
        public int length() {
            return read(text::length);
        }

        @Override
        public void insert(int index, String value) {
            mutate(() -> text.insert(index, value));
        }

        @Override
        public void delete(int index, int length) {
            mutate(() -> text.delete(index, index + length));
        }

        @Override
        public String toString() {
            return read(text::toString);
        }
    }
}
