package com.board.core.service.api.controller;

import com.board.core.service.api.dto.ApiResponse;
import com.board.core.service.api.dto.BoardImportRequest;
import com.board.core.service.session.BoardImportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for legacy board imports.
 *
 * Handles POST /boards/{boardId}/import for boards exported from the file store.
 */
@Slf4j
@RestController
@RequestMapping("/boards/{boardId}/import")
@Tag(name = "Board Import", description = "Migration of legacy board files into the graph store")
@RequiredArgsConstructor
public class BoardImportController {

    private final BoardImportService importService;

    /**
     * Writes a legacy board into the graph.
     *
     * @return 202 Accepted once the write cycle committed, 409 if the board is live,
     *         503 if the graph store is unreachable
     */
    @PostMapping
    @Operation(
            summary = "Import a legacy board",
            description = "Writes the board through a regular write cycle and reports store failures."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Board written"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Board has a live session"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Graph store rejected the write"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Graph store unavailable")
    })
    public ResponseEntity<ApiResponse<String>> importBoard(@PathVariable String boardId,
                                                           @Valid @RequestBody BoardImportRequest request) {
        log.debug("Received import for board {}", boardId);
        importService.importBoard(boardId, request.toSnapshot());
        return ResponseEntity.accepted().body(ApiResponse.success(boardId));
    }
}
