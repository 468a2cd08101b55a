package com.nevis.reports.service;

import java.util.List;

/**
 * Turns raw PDF bytes into one plain-text string per page. Implementations
 * never throw: unreadable input yields an empty list.
 */
public interface TextExtractor {

    List<String> extract(byte[] pdfBytes);
}
