package com.example.autocount.exception;

public class ScanFailureException extends VisualSearchException {

    public ScanFailureException(String message, Throwable cause) {
        super(ErrorType.INTERNAL_SCAN_FAILURE, message, cause);
    }
}
