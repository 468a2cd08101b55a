package com.nevis.reports.config;

import com.nevis.reports.infra.InMemoryRpmRateLimiter;
import com.nevis.reports.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LimiterConfig {

    @Bean("scanLimiter")
    public RateLimiter scanLimiter(
        @Value("${app.reports.scan.requests-per-minute:600}") int requestsPerMinute,
        @Value("${app.reports.scan.max-wait-ms:2000}") long maxWaitMs) {
        return new InMemoryRpmRateLimiter(requestsPerMinute, Duration.ofMillis(maxWaitMs));
    }
}
