package com.openforge.alchemy.store;

import lombok.Getter;

/**
 * Failure classes surfaced by every store operation.
 *
 * NOT_FOUND         identifier does not exist (record or relationship endpoint)
 * INVALID_ARGUMENT  malformed filter, out-of-range value, unknown enum, bad vector
 * CONFLICT          embedding metadata disagrees with the vector it describes
 * UNAVAILABLE       the SQLite file could not be reached or stayed locked; safe to retry
 */
@Getter
public enum StoreErrorKind {

    NOT_FOUND("not_found", false),
    INVALID_ARGUMENT("invalid_argument", false),
    CONFLICT("conflict", false),
    UNAVAILABLE("unavailable", true);

    private final String code;
    private final boolean retryable;

    StoreErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }
}
