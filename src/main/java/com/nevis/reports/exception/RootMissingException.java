package com.nevis.reports.exception;

public class RootMissingException extends RuntimeException {

    public RootMissingException(String message) {
        super(message);
    }
}
