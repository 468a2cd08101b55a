package com.nevis.reports.model;

import java.util.List;

public record Folder(
    String name,
    List<Document> documents
) {
    public Folder {
        documents = List.copyOf(documents);
    }

    public int pdfCount() {
        return documents.size();
    }
}
