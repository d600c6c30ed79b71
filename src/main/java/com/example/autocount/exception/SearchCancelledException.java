package com.example.autocount.exception;

public class SearchCancelledException extends VisualSearchException {

    public SearchCancelledException(String message) {
        super(ErrorType.SEARCH_CANCELLED, message);
    }
}
