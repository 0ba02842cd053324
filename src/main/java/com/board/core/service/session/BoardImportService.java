package com.board.core.service.session;

import com.board.core.service.document.DocumentSnapshot;
import com.board.core.service.persistence.GraphSynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes boards exported from the legacy file store into the graph.
 *
 * An import runs a regular write cycle, so importing the same file twice
 * leaves the graph unchanged. Boards with a live session are refused: their
 * document would overwrite the import on its next save. The import holds the
 * board lock, so a concurrent attach binds either before it or after it has
 * committed. Write failures propagate to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BoardImportService {

    private final BoardSessionRegistry registry;
    private final GraphSynchronizer synchronizer;

    public void importBoard(String boardId, DocumentSnapshot snapshot) {
        registry.withBoardLock(boardId, () -> {
            if (registry.isLive(boardId)) {
                throw new BoardSessionException("Board is open in a live session: " + boardId,
                        boardId, BoardSessionException.BOARD_LIVE);
            }
            log.info("Importing board {} ({}): {} items, {} connections", boardId,
                    snapshot.boardType(), snapshot.items().size(), snapshot.connections().size());
            synchronizer.writeOrFail(boardId, snapshot);
        });
    }
}
