package com.nevis.reports.service;

import com.nevis.reports.model.ScanCriteria;
import com.nevis.reports.model.SearchResult;

import java.util.List;

public interface SearchService {

    List<SearchResult> search(ScanCriteria criteria);
}
