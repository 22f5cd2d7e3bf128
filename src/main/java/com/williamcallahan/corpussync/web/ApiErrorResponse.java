package com.williamcallahan.corpussync.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Standard JSON error payload returned by every endpoint.
 *
 * @param status fixed status indicator, always "error"
 * @param message user-facing error message
 * @param details optional diagnostic details
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details) {

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse("error", message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse("error", message, details);
    }
}
