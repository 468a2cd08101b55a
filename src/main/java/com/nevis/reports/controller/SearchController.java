package com.nevis.reports.controller;

import com.nevis.reports.model.ScanCriteria;
import com.nevis.reports.service.SearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;

    @GetMapping
    public ResponseEntity<List<SearchResultResponse>> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "target_datetime", required = false) String targetDatetime) {

        if (query.isBlank()) {
            return ResponseEntity.ok(List.of());
        }

        ScanCriteria criteria = ScanCriteria.of(query, targetDatetime);

        List<SearchResultResponse> results = searchService.search(criteria).stream()
            .map(SearchResultResponse::from)
            .toList();

        return ResponseEntity.ok(results);
    }
}
