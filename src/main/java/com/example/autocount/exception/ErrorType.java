package com.example.autocount.exception;

/**
 * Failure categories reported to callers of the visual search engine.
 */
public enum ErrorType {
    INVALID_INPUT,
    TEMPLATE_TOO_LARGE,
    INTERNAL_SCAN_FAILURE,
    SEARCH_CANCELLED
}
