package com.nevis.reports.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * A PDF found during one scan. Page text is pulled from {@code textSource} on
 * first access and kept for the lifetime of this instance only.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public final class Document {

    @ToString.Include
    private final String folder;

    @ToString.Include
    private final String filename;

    private final long sizeBytes;
    private final OffsetDateTime createdAt;

    @ToString.Include
    private final OffsetDateTime modifiedAt;

    private final Path path;

    @Getter(AccessLevel.NONE)
    private final Supplier<List<String>> textSource;

    @Getter(lazy = true)
    private final List<String> extractedText = loadText();

    public Document(String folder, FileMetadata metadata, Path path, Supplier<List<String>> textSource) {
        this.folder = folder;
        this.filename = metadata.filename();
        this.sizeBytes = metadata.sizeBytes();
        this.createdAt = metadata.createdAt();
        this.modifiedAt = metadata.modifiedAt();
        this.path = path;
        this.textSource = textSource;
    }

    private List<String> loadText() {
        List<String> pages = textSource.get();
        return pages == null ? List.of() : List.copyOf(pages);
    }
}
