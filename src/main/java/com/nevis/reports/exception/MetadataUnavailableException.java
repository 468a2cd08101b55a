package com.nevis.reports.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class MetadataUnavailableException extends RuntimeException {
    private final Path path;

    public MetadataUnavailableException(Path path, Throwable cause) {
        super("Metadata unavailable for " + path, cause);
        this.path = path;
    }
}
