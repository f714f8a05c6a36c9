package com.openforge.alchemy.web;

import com.openforge.alchemy.store.StoreErrorKind;
import com.openforge.alchemy.store.StoreException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps store errors onto HTTP statuses:
 *   NOT_FOUND → 404, INVALID_ARGUMENT → 400, CONFLICT → 409, UNAVAILABLE → 503.
 * Malformed or invalid request bodies are reported as invalid_argument / 400.
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiError> handleStoreException(StoreException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("[Api] {} {} → {} {}", request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage(), ex);
        } else {
            log.warn("[Api] {} {} → {} {}", request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ApiError(ex.getKind().getCode(), truncate(ex.getMessage()), ex.isRetryable()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return badRequest(request, ex, message.isEmpty() ? "invalid request" : message);
    }

    @ExceptionHandler({
            BindException.class,
            HandlerMethodValidationException.class,
            ConstraintViolationException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        return badRequest(request, ex, ex.getMessage() == null ? "invalid request" : ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("[Api] {} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("internal", "internal error", false));
    }

    static HttpStatus statusOf(StoreErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND        -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case CONFLICT         -> HttpStatus.CONFLICT;
            case UNAVAILABLE      -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private ResponseEntity<ApiError> badRequest(HttpServletRequest request, Exception ex, String message) {
        log.warn("[Api] {} {} → 400 {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getClass().getSimpleName(), truncate(message));
        return ResponseEntity.badRequest()
                .body(new ApiError(StoreErrorKind.INVALID_ARGUMENT.getCode(), truncate(message), false));
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE_LENGTH) return text;
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
