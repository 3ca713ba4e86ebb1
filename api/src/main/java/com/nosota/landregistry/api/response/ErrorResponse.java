package com.nosota.landregistry.api.response;

import com.nosota.landregistry.api.model.ErrorKind;

import java.time.LocalDateTime;

/**
 * Error body returned for every failed workflow call.
 *
 * @param timestamp When the error was produced
 * @param status    HTTP status code
 * @param error     Short human-readable error title
 * @param kind      Workflow error kind, stable across releases
 * @param message   Actionable message naming the failed condition
 * @param path      Request path
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        ErrorKind kind,
        String message,
        String path
) {

    public static ErrorResponse of(int status, String error, ErrorKind kind, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, kind, message, path);
    }
}
