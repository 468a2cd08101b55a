package com.nevis.reports.service;

import com.nevis.reports.exception.MetadataUnavailableException;
import com.nevis.reports.model.FileMetadata;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Component
public class MetadataResolver {

    /**
     * Reads name, size and timestamps of a file. Timestamps are normalized to
     * UTC so they compare safely against any cutoff.
     *
     * @throws MetadataUnavailableException if the file vanished or cannot be stat'ed
     */
    public FileMetadata resolve(Path path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new FileMetadata(
                path.getFileName().toString(),
                attributes.size(),
                toUtc(attributes.creationTime()),
                toUtc(attributes.lastModifiedTime())
            );
        } catch (IOException e) {
            throw new MetadataUnavailableException(path, e);
        }
    }

    private static OffsetDateTime toUtc(FileTime time) {
        return time.toInstant().atOffset(ZoneOffset.UTC);
    }
}
