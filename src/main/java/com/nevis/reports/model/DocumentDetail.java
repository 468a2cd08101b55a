package com.nevis.reports.model;

import java.util.List;

public record DocumentDetail(
    Document document,
    List<String> pages
) {
    public int pageCount() {
        return pages.size();
    }

    public String textContent() {
        return String.join("\n", pages).strip();
    }
}
