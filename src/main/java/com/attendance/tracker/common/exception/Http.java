package com.attendance.tracker.common.exception;

import com.attendance.tracker.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        } else {
            String errorCode = r.getErrorCode();
            if (errorCode == null) {
                return ResponseEntity.badRequest().body(r.getError());
            }

            HttpStatus status = switch (errorCode) {
                case "ERR-AUTH-001" -> HttpStatus.UNAUTHORIZED;
                case "ERR-DB-001" -> HttpStatus.NOT_FOUND;
                case "ERR-CONFLICT" -> HttpStatus.CONFLICT;
                case "ERR-DB-002", "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
                case "ERR-VAL-001", "ERR-VAL-002", "ERR-VAL-003",
                     "ERR-REQ-001", "ERR-REQ-003", "ERR-REQ-004" -> HttpStatus.BAD_REQUEST;
                case "ERR-REQ-002" -> HttpStatus.METHOD_NOT_ALLOWED;
                case "ERR-REQ-005" -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
                case "ERR-REQ-006" -> HttpStatus.NOT_FOUND;
                default -> HttpStatus.BAD_REQUEST;
            };

            return ResponseEntity.status(status).body(new ErrorResponse(r.getErrorCode(), r.getError(), r.getTimestamp()));
        }
    }

    /**
     * Error body returned to clients.
     */
    public record ErrorResponse(String code, String message, java.time.Instant timestamp) {}
}
