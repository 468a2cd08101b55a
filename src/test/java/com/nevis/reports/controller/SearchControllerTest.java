package com.nevis.reports.controller;

import com.nevis.reports.exception.RateLimitExceededException;
import com.nevis.reports.model.Document;
import com.nevis.reports.model.FileMetadata;
import com.nevis.reports.model.ScanCriteria;
import com.nevis.reports.model.SearchResult;
import com.nevis.reports.service.SearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SearchService searchService;

    @Test
    @DisplayName("Should return ranked results with matches and match count")
    void search_ShouldReturnResults() throws Exception {
        OffsetDateTime modified = OffsetDateTime.parse("2024-01-05T00:00:00Z");
        Document q1 = new Document("financial_reports", new FileMetadata("Q1.pdf", 100, modified, modified),
            Path.of("/reports/financial_reports/Q1.pdf"), () -> List.of());
        when(searchService.search(any()))
            .thenReturn(List.of(new SearchResult(q1, List.of("Page 1: Revenue grew 10%"), 1)));

        mockMvc.perform(get("/api/search").param("q", "Revenue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].pdf.filename").value("Q1.pdf"))
            .andExpect(jsonPath("$[0].pdf.folder").value("financial_reports"))
            .andExpect(jsonPath("$[0].matches[0]").value("Page 1: Revenue grew 10%"))
            .andExpect(jsonPath("$[0].match_count").value(1));
    }

    @Test
    @DisplayName("Should build criteria from query and cutoff")
    void search_ShouldPassCriteria() throws Exception {
        when(searchService.search(any())).thenReturn(List.of());

        mockMvc.perform(get("/api/search")
                .param("q", "  Revenue ")
                .param("target_datetime", "2024-03-01T00:00:00Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());

        ArgumentCaptor<ScanCriteria> captor = ArgumentCaptor.forClass(ScanCriteria.class);
        verify(searchService).search(captor.capture());
        assertThat(captor.getValue().query()).contains("Revenue");
        assertThat(captor.getValue().cutoff()).contains(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should return empty results for a blank query without validating the cutoff")
    void search_ShouldReturnEmpty_WhenQueryIsBlank() throws Exception {
        mockMvc.perform(get("/api/search")
                .param("q", "   ")
                .param("target_datetime", "not-a-date"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());

        verifyNoInteractions(searchService);
    }

    @Test
    @DisplayName("Should return 400 Bad Request when query 'q' is missing")
    void search_ShouldReturn400_WhenQueryIsMissing() throws Exception {
        mockMvc.perform(get("/api/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"));
    }

    @Test
    @DisplayName("Should return 429 when scans are rate limited")
    void search_ShouldReturn429_WhenRateLimited() throws Exception {
        when(searchService.search(any())).thenThrow(new RateLimitExceededException("scan_limit"));

        mockMvc.perform(get("/api/search").param("q", "Revenue"))
            .andExpect(status().isTooManyRequests());
    }

    @Test
    @DisplayName("Should hide internal errors behind a generic 500")
    void search_ShouldReturn500_OnUnexpectedError() throws Exception {
        when(searchService.search(any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/search").param("q", "Revenue"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
