package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.domain.UnknownCollectionException;
import com.williamcallahan.corpussync.domain.UnknownSourceException;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Base controller mapping the domain exceptions every endpoint can raise to error responses.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(UnknownSourceException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownSource(UnknownSourceException unknownSource) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, unknownSource.getMessage());
    }

    @ExceptionHandler(UnknownCollectionException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownCollection(UnknownCollectionException unknownCollection) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, unknownCollection.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException invalid) {
        String details = invalid.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException unreadable) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException invalid) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, invalid.getMessage());
    }
}
