package com.nevis.reports.model;

import com.nevis.reports.exception.WrongQueryException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Validated request parameters for listing and search. The query is stored
 * trimmed and is empty when the caller sent nothing but whitespace.
 */
public record ScanCriteria(
    Optional<String> query,
    Optional<Instant> cutoff
) {

    public static ScanCriteria of(String query, String targetDatetime) {
        return new ScanCriteria(
            Optional.ofNullable(query).map(String::trim).filter(q -> !q.isEmpty()),
            parseCutoff(targetDatetime)
        );
    }

    public static ScanCriteria cutoffOnly(String targetDatetime) {
        return of(null, targetDatetime);
    }

    /**
     * Accepts an ISO-8601 date-time with offset or zone, a local date-time
     * (read as UTC) or a plain date (midnight UTC).
     */
    static Optional<Instant> parseCutoff(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        try {
            if (text.indexOf('T') < 0) {
                return Optional.of(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            throw new WrongQueryException("Invalid datetime format: " + text);
        }
    }
}
