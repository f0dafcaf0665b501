package com.assetdesk.allocation.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors,
    Boolean retryable
) {
    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path) {
        this(status, error, message, timestamp, path, List.of(), null);
    }

    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path, List<FieldError> fieldErrors) {
        this(status, error, message, timestamp, path, fieldErrors, null);
    }

    public static ErrorResponse retryable(int status, String error, String message,
                                          Instant timestamp, String path) {
        return new ErrorResponse(status, error, message, timestamp, path, List.of(), Boolean.TRUE);
    }

    public record FieldError(String field, String message) {}
}
