package com.example.autocount.exception;

/**
 * Base class for every failure raised while preparing or running a symbol search. The
 * {@link ErrorType} travels with the exception so both the REST layer and the command line
 * wrapper can report it without inspecting the concrete subclass.
 */
public abstract class VisualSearchException extends RuntimeException {

    private final ErrorType errorType;

    protected VisualSearchException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected VisualSearchException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
