package com.board.core.service.session;

import com.board.core.service.config.MetricsConfig;
import com.board.core.service.document.BoardDocument;
import com.board.core.service.document.DocumentLifecycle;
import com.board.core.service.document.DocumentSnapshot;
import com.board.core.service.document.InMemoryBoardDocument;
import com.board.core.service.persistence.GraphSynchronizer;
import com.board.core.service.persistence.SessionBinder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hosts the live document of every board that has connected clients.
 *
 * The first client of a board creates its document and binds it from the
 * graph store. Every client edit requests a debounced save, and the last
 * client to leave triggers a final write.
 *
 * One lock per board id, kept across sessions, serializes binds, writes and
 * the release of a session. A client that re-attaches while the previous
 * session's final write runs binds only after that write has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BoardSessionRegistry {

    private final SessionBinder binder;
    private final GraphSynchronizer synchronizer;
    private final SaveQueue saveQueue;
    private final MetricsConfig metricsConfig;

    private final Map<String, BoardSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> boardLocks = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerGauge("board.sessions.live", "Boards with a live document", sessions::size);
    }

    @PreDestroy
    void flushAll() {
        log.info("Flushing {} live boards before shutdown", sessions.size());
        sessions.keySet().forEach(this::flush);
    }

    // ==================== Lifecycle ====================

    /**
     * Registers a client for the board, creating and binding its document on first use.
     *
     * @param boardId the board identifier
     * @return the document state after binding
     */
    public DocumentSnapshot attach(String boardId) {
        var session = sessions.compute(boardId, (id, existing) -> {
            var current = existing != null ? existing : openSession(id);
            current.clients++;
            return current;
        });
        bindIfNeeded(boardId, session);
        return session.document.snapshot();
    }

    /**
     * Unregisters a client. The last client out writes the document and releases it.
     *
     * @param boardId the board identifier
     * @return false if the board had no live session
     */
    public boolean detach(String boardId) {
        var released = new AtomicReference<BoardSession>();
        var lock = lockFor(boardId);
        lock.lock();
        try {
            var remaining = sessions.computeIfPresent(boardId, (id, session) -> {
                session.clients--;
                if (session.clients > 0) {
                    return session;
                }
                released.set(session);
                return null;
            });

            if (released.get() != null) {
                flushSession(boardId, released.get());
                log.info("Released board {}", boardId);
            }
            return remaining != null || released.get() != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean isLive(String boardId) {
        return sessions.containsKey(boardId);
    }

    public Optional<BoardDocument> findDocument(String boardId) {
        return Optional.ofNullable(sessions.get(boardId)).map(session -> session.document);
    }

    public int getLiveCount() {
        return sessions.size();
    }

    // ==================== Saving ====================

    /**
     * Queues a debounced save for a live board.
     */
    public SaveStatus requestSave(String boardId) {
        if (!sessions.containsKey(boardId)) {
            return SaveStatus.NOT_LIVE;
        }
        return saveQueue.enqueue(boardId) ? SaveStatus.QUEUED : SaveStatus.REJECTED;
    }

    /**
     * Writes the current document of a live board to the graph store.
     * Does nothing if the board has no live session.
     */
    public void flush(String boardId) {
        withBoardLock(boardId, () -> {
            var session = sessions.get(boardId);
            if (session == null) {
                log.debug("Board {} no longer live, save skipped", boardId);
                return;
            }
            flushSession(boardId, session);
        });
    }

    /**
     * Runs the action while no bind, write or release of the board is in progress.
     */
    public void withBoardLock(String boardId, Runnable action) {
        var lock = lockFor(boardId);
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Private Methods ====================

    private BoardSession openSession(String boardId) {
        var document = new InMemoryBoardDocument(boardId);
        document.addUpdateListener(() -> requestSave(boardId));
        log.info("Opened document for board {}", boardId);
        return new BoardSession(document);
    }

    private ReentrantLock lockFor(String boardId) {
        return boardLocks.computeIfAbsent(boardId, id -> new ReentrantLock());
    }

    private void bindIfNeeded(String boardId, BoardSession session) {
        withBoardLock(boardId, () -> {
            if (session.document.getLifecycle() == DocumentLifecycle.UNINITIALIZED) {
                binder.bind(boardId, session.document);
                session.bound = session.document.getLifecycle() != DocumentLifecycle.UNINITIALIZED;
            }
        });
    }

    /**
     * Callers hold the board lock.
     */
    private void flushSession(String boardId, BoardSession session) {
        if (!session.bound) {
            // An unbound document does not reflect the store; writing it would delete the board's items.
            log.warn("Board {} was never loaded from the graph store, save skipped", boardId);
            return;
        }
        if (session.document.getLifecycle() != DocumentLifecycle.DIVERGED) {
            log.debug("Board {} has no edits since load, save skipped", boardId);
            return;
        }
        synchronizer.write(boardId, session.document.snapshot());
    }

    // ==================== Inner Classes ====================

    /**
     * Live state of one board. {@code clients} is only touched inside map compute functions.
     */
    private static class BoardSession {
        final BoardDocument document;
        int clients = 0;
        volatile boolean bound = false;

        BoardSession(BoardDocument document) {
            this.document = document;
        }
    }
}
