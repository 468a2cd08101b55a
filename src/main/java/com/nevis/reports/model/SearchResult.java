package com.nevis.reports.model;

import java.util.List;

public record SearchResult(
    Document document,
    List<String> matches,
    int matchCount
) {
    public SearchResult {
        if (matchCount < 1) {
            throw new IllegalArgumentException("Search result without matches: " + matchCount);
        }
        matches = List.copyOf(matches);
    }
}
