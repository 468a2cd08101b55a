package com.nevis.reports.controller;

import com.nevis.reports.model.ScanCriteria;
import com.nevis.reports.service.FolderIndexer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/folders")
@RequiredArgsConstructor
public class FolderController {

    private final FolderIndexer folderIndexer;

    @GetMapping
    public ResponseEntity<List<FolderResponse>> listFolders(
        @RequestParam(name = "target_datetime", required = false) String targetDatetime) {

        ScanCriteria criteria = ScanCriteria.cutoffOnly(targetDatetime);

        List<FolderResponse> folders = folderIndexer.listFolders(criteria.cutoff()).stream()
            .map(FolderResponse::from)
            .toList();

        return ResponseEntity.ok(folders);
    }
}
