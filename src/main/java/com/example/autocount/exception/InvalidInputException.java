package com.example.autocount.exception;

public class InvalidInputException extends VisualSearchException {

    public InvalidInputException(String message) {
        super(ErrorType.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(ErrorType.INVALID_INPUT, message, cause);
    }
}
