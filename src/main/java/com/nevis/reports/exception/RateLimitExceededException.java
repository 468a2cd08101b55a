package com.nevis.reports.exception;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {
    private final String key;

    public RateLimitExceededException(String key) {
        super("Too many requests for " + key + ", try again later");
        this.key = key;
    }
}
