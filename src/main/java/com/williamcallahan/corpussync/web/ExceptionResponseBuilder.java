package com.williamcallahan.corpussync.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    private static final int MAX_DETAIL_LENGTH = 512;

    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, String details) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, sanitize(details)));
    }

    /**
     * Describes an exception as {@code SimpleName: message} for the details field.
     */
    public String describeException(Throwable exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        String name = exception.getClass().getSimpleName();
        return message == null || message.isBlank() ? name : name + ": " + message;
    }

    private static String sanitize(String details) {
        if (details == null) {
            return null;
        }
        String singleLine = details.replace('\r', ' ').replace('\n', ' ').trim();
        return singleLine.length() > MAX_DETAIL_LENGTH
                ? singleLine.substring(0, MAX_DETAIL_LENGTH) + "..."
                : singleLine;
    }
}
