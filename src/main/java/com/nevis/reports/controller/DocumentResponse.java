package com.nevis.reports.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.reports.model.Document;

import java.time.OffsetDateTime;

public record DocumentResponse(
    String filename,

    String folder,

    long size,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("modified_at")
    OffsetDateTime modifiedAt
) {
    public static DocumentResponse from(Document document) {
        return new DocumentResponse(
            document.getFilename(),
            document.getFolder(),
            document.getSizeBytes(),
            document.getCreatedAt(),
            document.getModifiedAt()
        );
    }
}
