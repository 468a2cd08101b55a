package com.nevis.reports.exception;

public class DocumentNotFoundException extends EntityNotFoundException {

    public DocumentNotFoundException(String folder, String filename) {
        super("Document not found: " + folder + "/" + filename);
    }
}
