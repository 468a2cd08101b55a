package com.nevis.reports.service;

import com.nevis.reports.exception.DocumentNotFoundException;
import com.nevis.reports.exception.MetadataUnavailableException;
import com.nevis.reports.exception.PathTraversalRejectedException;
import com.nevis.reports.model.Document;
import com.nevis.reports.model.DocumentDetail;
import com.nevis.reports.model.FileMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final ReportsRoot reportsRoot;
    private final MetadataResolver metadataResolver;
    private final TextExtractor textExtractor;

    @Override
    public byte[] fetchBytes(String folder, String filename) {
        Path file = resolve(folder, filename);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            throw new DocumentNotFoundException(folder, filename);
        }
    }

    @Override
    public DocumentDetail getDocument(String folder, String filename) {
        Path file = resolve(folder, filename);
        FileMetadata metadata;
        try {
            metadata = metadataResolver.resolve(file);
        } catch (MetadataUnavailableException e) {
            log.warn("Document {}/{} vanished while reading metadata", folder, filename);
            throw new DocumentNotFoundException(folder, filename);
        }
        Document document = new Document(folder, metadata, file, () -> readText(file));
        return new DocumentDetail(document, document.getExtractedText());
    }

    private List<String> readText(Path file) {
        try {
            return textExtractor.extract(Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    /**
     * Maps a folder/filename pair to a PDF exactly one level below the root.
     * Both names must be single path elements, and the real path (symlinks
     * resolved) must still sit directly in a folder of the real root.
     */
    Path resolve(String folder, String filename) {
        Path root = reportsRoot.require();
        if (!isPlainName(folder) || !isPlainName(filename)) {
            return reject(folder, filename);
        }

        Path candidate;
        try {
            candidate = root.resolve(folder).resolve(filename).normalize();
        } catch (InvalidPathException e) {
            return reject(folder, filename);
        }
        if (!candidate.startsWith(root) || !root.equals(grandParent(candidate))) {
            return reject(folder, filename);
        }
        if (!FileSystemFolderIndexer.isPdf(candidate)) {
            throw new DocumentNotFoundException(folder, filename);
        }
        if (!Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS)) {
            throw new DocumentNotFoundException(folder, filename);
        }

        try {
            Path real = candidate.toRealPath();
            Path realRoot = root.toRealPath();
            if (!realRoot.equals(grandParent(real))) {
                return reject(folder, filename);
            }
            return real;
        } catch (IOException e) {
            throw new DocumentNotFoundException(folder, filename);
        }
    }

    private static Path grandParent(Path path) {
        Path parent = path.getParent();
        return parent == null ? null : parent.getParent();
    }

    private static boolean isPlainName(String name) {
        return name != null
            && !name.isBlank()
            && !name.equals(".")
            && !name.equals("..")
            && name.indexOf('/') < 0
            && name.indexOf('\\') < 0
            && name.indexOf('\0') < 0;
    }

    private static Path reject(String folder, String filename) {
        log.warn("Rejected path outside reports root: folder='{}', filename='{}'", folder, filename);
        throw new PathTraversalRejectedException(folder, filename);
    }
}
