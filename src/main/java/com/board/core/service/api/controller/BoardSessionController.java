package com.board.core.service.api.controller;

import com.board.core.service.api.dto.ApiResponse;
import com.board.core.service.document.BoardDocument;
import com.board.core.service.document.DocumentSnapshot;
import com.board.core.service.session.BoardSessionException;
import com.board.core.service.session.BoardSessionRegistry;
import com.board.core.service.session.SaveQueue;
import com.board.core.service.session.SaveStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for board sessions.
 *
 * Lets operators open and close boards, inspect live documents and force saves.
 */
@Slf4j
@RestController
@RequestMapping("/boards/{boardId}")
@Tag(name = "Board Sessions", description = "Live board documents and their persistence")
@RequiredArgsConstructor
public class BoardSessionController {

    private final BoardSessionRegistry registry;
    private final SaveQueue saveQueue;

    @PostMapping("/session")
    @Operation(
            summary = "Attach to a board",
            description = "Registers a client. The first client loads the board from the graph store."
    )
    public ResponseEntity<ApiResponse<DocumentSnapshot>> attach(@PathVariable String boardId) {
        log.debug("Attach requested for board {}", boardId);
        return ResponseEntity.ok(ApiResponse.success(registry.attach(boardId)));
    }

    @DeleteMapping("/session")
    @Operation(
            summary = "Detach from a board",
            description = "Unregisters a client. The last client writes the board and releases its document."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Client detached"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Board not live")
    })
    public ResponseEntity<ApiResponse<String>> detach(@PathVariable String boardId) {
        if (!registry.detach(boardId)) {
            throw BoardSessionException.notLive(boardId);
        }
        return ResponseEntity.ok(ApiResponse.success(boardId));
    }

    @GetMapping("/document")
    @Operation(summary = "Get the live document of a board")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Document found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Board not live")
    })
    public ResponseEntity<ApiResponse<DocumentSnapshot>> getDocument(@PathVariable String boardId) {
        return registry.findDocument(boardId)
                .map(BoardDocument::snapshot)
                .map(snapshot -> ResponseEntity.ok(ApiResponse.success(snapshot)))
                .orElseThrow(() -> BoardSessionException.notLive(boardId));
    }

    /**
     * Requests a save of a live board.
     *
     * @return 202 Accepted if queued, 404 if the board is not live, 429 if the queue is full
     */
    @PostMapping("/save")
    @Operation(
            summary = "Request a save",
            description = "Queues a debounced write of the live document to the graph store."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Save queued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Board not live"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Save queue full")
    })
    public ResponseEntity<ApiResponse<String>> save(@PathVariable String boardId) {
        SaveStatus status = registry.requestSave(boardId);
        return switch (status) {
            case QUEUED -> ResponseEntity.accepted().body(ApiResponse.success(boardId));
            case NOT_LIVE -> throw BoardSessionException.notLive(boardId);
            case REJECTED -> throw new BoardSessionException(
                    "Save queue is full, please retry later (utilization " + saveQueue.getUtilizationPercent() + "%)",
                    boardId, BoardSessionException.SAVE_QUEUE_FULL);
        };
    }
}
