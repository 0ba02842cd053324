package com.board.core.service.api.dto;

import com.board.core.service.document.DocumentSnapshot;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO for legacy board imports.
 *
 * Mirrors the board files of the legacy file store. Items and connections are
 * free-form records; only their {@code id} (and a connection's {@code from}
 * and {@code to}) are required for them to be written. Connections may be omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardImportRequest {

    /**
     * Board type, the default board type when absent.
     */
    private String boardType;

    @NotNull(message = "items are required")
    private List<Map<String, Object>> items;

    private List<Map<String, Object>> connections;

    public DocumentSnapshot toSnapshot() {
        return new DocumentSnapshot(items, connections, boardType);
    }
}
