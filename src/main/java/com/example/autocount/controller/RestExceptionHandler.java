package com.example.autocount.controller;

import com.example.autocount.exception.ErrorType;
import com.example.autocount.exception.VisualSearchException;
import com.example.autocount.model.SearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

import java.util.stream.Collectors;

/**
 * Turns search failures into the same {@code success=false} body the command line prints.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(VisualSearchException.class)
    public ResponseEntity<SearchResponse> handleVisualSearch(VisualSearchException ex) {
        HttpStatus status = statusFor(ex.getErrorType());
        if (status.is5xxServerError()) {
            log.error("Visual search failed", ex);
        } else {
            log.warn("Rejected visual search request: {}", ex.getMessage());
        }
        return buildResponse(status, ex.getErrorType(), ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<SearchResponse> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        ErrorType errorType = status.is4xxClientError() ? ErrorType.INVALID_INPUT : ErrorType.INTERNAL_SCAN_FAILURE;
        return buildResponse(status, errorType, ex.getReason());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SearchResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
        return buildResponse(HttpStatus.BAD_REQUEST, ErrorType.INVALID_INPUT, message);
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<SearchResponse> handleMissingInput(Exception ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ErrorType.INVALID_INPUT, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<SearchResponse> handleIllegalState(IllegalStateException ex) {
        log.error("Unexpected processing error", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.INTERNAL_SCAN_FAILURE, ex.getMessage());
    }

    static HttpStatus statusFor(ErrorType errorType) {
        switch (errorType) {
            case INVALID_INPUT:
                return HttpStatus.BAD_REQUEST;
            case TEMPLATE_TOO_LARGE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case SEARCH_CANCELLED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<SearchResponse> buildResponse(HttpStatus status, ErrorType errorType, String message) {
        return ResponseEntity.status(status).body(SearchResponse.failure(errorType.name(), message));
    }
}
