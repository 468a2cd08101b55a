package com.nevis.reports.service;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Optional;

@Component
public class TemporalFilter {

    /**
     * A document is visible "as of" the cutoff when it was last modified at or
     * before it. Without a cutoff everything is visible.
     */
    public boolean include(Optional<Instant> cutoff, OffsetDateTime modifiedAt) {
        return cutoff
            .map(c -> !modifiedAt.toInstant().isAfter(c))
            .orElse(true);
    }
}
