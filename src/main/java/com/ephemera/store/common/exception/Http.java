package com.ephemera.store.common.exception;

import com.ephemera.store.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {
    private Http() {
    }

    public static HttpStatus statusOf(String errorCode) {
        if (errorCode == null) return HttpStatus.BAD_REQUEST;
        return switch (errorCode) {
            case "ERR-AUTH-001" -> HttpStatus.UNAUTHORIZED;
            case "ERR-AUTH-002" -> HttpStatus.FORBIDDEN;
            case "ERR-NOT-FOUND" -> HttpStatus.NOT_FOUND;
            case "ERR-DB-003" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ERR-DB-002", "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            case "ERR-REQ-002" -> HttpStatus.METHOD_NOT_ALLOWED;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    public static ResponseEntity<ErrorResponse> from(Result<?> r) {
        return ResponseEntity.status(statusOf(r.getErrorCode()))
                .body(new ErrorResponse(r.getErrorCode(), r.getError(), r.getTimestamp()));
    }

    public static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, Instant.now()));
    }

    /**
     * Simple error response structure that will be returned to clients
     */
    public record ErrorResponse(String code, String message, Instant timestamp) {
    }
}
