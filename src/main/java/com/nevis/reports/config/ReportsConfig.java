package com.nevis.reports.config;

import com.nevis.reports.service.CachingTextExtractor;
import com.nevis.reports.service.PdfTextExtractor;
import com.nevis.reports.service.ReportsRoot;
import com.nevis.reports.service.TextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ReportsConfig {

    @Bean
    public ReportsRoot reportsRoot(ReportsProperties properties) {
        log.info("Serving PDF reports from {}", properties.root());
        return new ReportsRoot(properties.root());
    }

    @Bean
    public TextExtractor textExtractor(
        @Value("${app.reports.text-cache.enabled:true}") boolean cacheEnabled,
        @Value("${app.reports.text-cache.max-entries:256}") int maxEntries) {
        TextExtractor pdfExtractor = new PdfTextExtractor();
        if (!cacheEnabled) {
            log.info("Extracted text cache disabled");
            return pdfExtractor;
        }
        log.info("Extracted text cache enabled with {} entries", maxEntries);
        return new CachingTextExtractor(pdfExtractor, maxEntries);
    }
}
