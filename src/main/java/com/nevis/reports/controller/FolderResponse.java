package com.nevis.reports.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.reports.model.Folder;

import java.util.List;

public record FolderResponse(
    String name,
    @JsonProperty("pdf_count") int pdfCount,
    List<DocumentResponse> pdfs
) {
    public static FolderResponse from(Folder folder) {
        return new FolderResponse(
            folder.name(),
            folder.pdfCount(),
            folder.documents().stream().map(DocumentResponse::from).toList()
        );
    }
}
