package com.board.core.service.session;

/**
 * Outcome of a save request.
 */
public enum SaveStatus {
    QUEUED,
    NOT_LIVE,
    REJECTED
}
