package com.nevis.reports.exception;

public class WrongQueryException extends RuntimeException {

    public WrongQueryException(String message) {
        super(message);
    }
}
