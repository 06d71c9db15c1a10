package com.todoservice.common.status;

/**
 * Status codes used across the todo service, each bound to the HTTP status code a REST client
 * sees when an operation fails with it.
 */
public enum StatusCode {
    OK(200),                 // 200 OK
    INVALID_ARGUMENT(400),   // 400 Bad Request
    NOT_FOUND(404),          // 404 Not Found
    DEADLINE_EXCEEDED(500),  // store timeouts are reported to clients as 500
    UNAVAILABLE(500),        // store unreachable
    INTERNAL(500);           // 500 Internal Server Error

    private final int httpCode;

    StatusCode(int httpCode) {
        this.httpCode = httpCode;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns whether this status code is the caller's fault (a 4xx response).
     */
    public boolean isClientError() {
        return httpCode >= 400 && httpCode < 500;
    }
}
