package com.nevis.reports.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox based extractor. Pages are stripped one at a time so page numbers
 * stay aligned with the document; a page without a text layer comes back as
 * an empty string.
 */
@Slf4j
public class PdfTextExtractor implements TextExtractor {

    @Override
    public List<String> extract(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            log.warn("Skipping text extraction: empty input");
            return List.of();
        }
        try (PDDocument document = PDDocument.load(pdfBytes)) {
            int totalPages = document.getNumberOfPages();
            log.debug("Extracting text from {} pages", totalPages);

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(totalPages);
            for (int page = 1; page <= totalPages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document);
                pages.add(text == null ? "" : text.replace("\u0000", "").strip());
            }
            return pages;
        } catch (IOException | RuntimeException e) {
            log.warn("Could not extract text from PDF ({} bytes): {}", pdfBytes.length, e.getMessage());
            return List.of();
        }
    }
}
