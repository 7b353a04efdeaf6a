package com.attendance.tracker.common;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode, Instant timestamp) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = (timestamp == null ? Instant.now() : timestamp);
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null, Instant.now());
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code, Instant.now());
    }

    // ---------- convenience helpers ----------

    /**
     * Convenience alias: true when successful.
     */
    public boolean isOk() {
        return success;
    }

    /**
     * True when failed.
     */
    public boolean isFailure() {
        return !success;
    }
}
