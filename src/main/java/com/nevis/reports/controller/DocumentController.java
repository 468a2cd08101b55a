package com.nevis.reports.controller;

import com.nevis.reports.service.DocumentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @GetMapping("/pdf/{folder}/{filename}")
    public ResponseEntity<byte[]> getPdf(@PathVariable String folder, @PathVariable String filename) {
        byte[] content = documentService.fetchBytes(folder, filename);

        ContentDisposition disposition = ContentDisposition.inline()
            .filename(filename, StandardCharsets.UTF_8)
            .build();

        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_PDF)
            .contentLength(content.length)
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .body(content);
    }

    @GetMapping("/pdf-info/{folder}/{filename}")
    public ResponseEntity<DocumentDetailResponse> getPdfInfo(@PathVariable String folder, @PathVariable String filename) {
        return ResponseEntity.ok(DocumentDetailResponse.from(documentService.getDocument(folder, filename)));
    }
}
