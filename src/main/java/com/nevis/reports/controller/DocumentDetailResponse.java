package com.nevis.reports.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.reports.model.Document;
import com.nevis.reports.model.DocumentDetail;

import java.time.OffsetDateTime;

public record DocumentDetailResponse(
    String filename,
    String folder,
    long size,
    @JsonProperty("created_at") OffsetDateTime createdAt,
    @JsonProperty("modified_at") OffsetDateTime modifiedAt,
    @JsonProperty("page_count") int pageCount,
    @JsonProperty("text_content") String textContent
) {
    public static DocumentDetailResponse from(DocumentDetail detail) {
        Document document = detail.document();
        return new DocumentDetailResponse(
            document.getFilename(),
            document.getFolder(),
            document.getSizeBytes(),
            document.getCreatedAt(),
            document.getModifiedAt(),
            detail.pageCount(),
            detail.textContent()
        );
    }
}
