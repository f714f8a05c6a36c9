package com.openforge.alchemy.store;

import lombok.Getter;

/**
 * The single exception type thrown by store operations.
 * Callers branch on {@link #getKind()}; {@link #isRetryable()} tells them
 * whether re-invoking the same call can succeed without changing its input.
 */
@Getter
public class StoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final StoreErrorKind kind;

    public StoreException(StoreErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(StoreErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static StoreException notFound(String what, Object id) {
        return new StoreException(StoreErrorKind.NOT_FOUND, "%s not found: %s".formatted(what, id));
    }

    public static StoreException invalid(String message) {
        return new StoreException(StoreErrorKind.INVALID_ARGUMENT, message);
    }

    public static StoreException conflict(String message) {
        return new StoreException(StoreErrorKind.CONFLICT, message);
    }

    public static StoreException unavailable(String message, Throwable cause) {
        return new StoreException(StoreErrorKind.UNAVAILABLE, message, cause);
    }

    @Override
    public String toString() {
        return "StoreException{kind=" + kind + ", message='" + getMessage() + "'}";
    }
}
