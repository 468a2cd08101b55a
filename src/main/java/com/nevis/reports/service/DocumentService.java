package com.nevis.reports.service;

import com.nevis.reports.model.DocumentDetail;

public interface DocumentService {

    byte[] fetchBytes(String folder, String filename);

    DocumentDetail getDocument(String folder, String filename);
}
