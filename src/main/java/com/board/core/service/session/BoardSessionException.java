package com.board.core.service.session;

/**
 * Exception thrown when a board session operation cannot be carried out.
 */
public class BoardSessionException extends RuntimeException {

    public static final String BOARD_NOT_LIVE = "BOARD_NOT_LIVE";
    public static final String BOARD_LIVE = "BOARD_LIVE";
    public static final String SAVE_QUEUE_FULL = "SAVE_QUEUE_FULL";

    private final String boardId;
    private final String errorCode;

    public BoardSessionException(String message, String boardId, String errorCode) {
        super(message);
        this.boardId = boardId;
        this.errorCode = errorCode;
    }

    public static BoardSessionException notLive(String boardId) {
        return new BoardSessionException("Board has no live session: " + boardId, boardId, BOARD_NOT_LIVE);
    }

    public String getBoardId() {
        return boardId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
