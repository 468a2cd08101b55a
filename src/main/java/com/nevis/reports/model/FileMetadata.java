package com.nevis.reports.model;

import java.time.OffsetDateTime;

public record FileMetadata(
    String filename,
    long sizeBytes,
    OffsetDateTime createdAt,
    OffsetDateTime modifiedAt
) {}
