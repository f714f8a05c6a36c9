package com.openforge.alchemy.web;

/**
 * Error body returned by every endpoint.
 *
 * @param code      stable machine-readable kind ("not_found", "invalid_argument" …)
 * @param retryable whether the same request may succeed later unchanged
 */
public record ApiError(String code, String message, boolean retryable) {}
