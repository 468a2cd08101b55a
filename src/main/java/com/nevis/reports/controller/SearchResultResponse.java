package com.nevis.reports.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.reports.model.SearchResult;

import java.util.List;

public record SearchResultResponse(
    DocumentResponse pdf,
    List<String> matches,
    @JsonProperty("match_count") int matchCount
) {
    public static SearchResultResponse from(SearchResult result) {
        return new SearchResultResponse(
            DocumentResponse.from(result.document()),
            result.matches(),
            result.matchCount()
        );
    }
}
