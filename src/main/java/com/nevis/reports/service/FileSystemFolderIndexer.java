package com.nevis.reports.service;

import com.nevis.reports.exception.MetadataUnavailableException;
import com.nevis.reports.exception.RootMissingException;
import com.nevis.reports.infra.RateLimiter;
import com.nevis.reports.model.Document;
import com.nevis.reports.model.FileMetadata;
import com.nevis.reports.model.Folder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the folder/document view straight from the filesystem on every call.
 * Only the immediate subdirectories of the root are folders; symbolic links are
 * not followed, so everything listed can also be fetched.
 */
@Service
@Slf4j
public class FileSystemFolderIndexer implements FolderIndexer {

    public static final String SCAN_LIMIT = "scan_limit";

    /** Case-insensitive filename order, case-sensitive on ties. */
    public static final Comparator<Document> BY_FILENAME = Comparator
        .comparing(Document::getFilename, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(Document::getFilename);

    private final ReportsRoot reportsRoot;
    private final MetadataResolver metadataResolver;
    private final TextExtractor textExtractor;
    private final TemporalFilter temporalFilter;
    private final RateLimiter scanLimiter;

    public FileSystemFolderIndexer(
        ReportsRoot reportsRoot,
        MetadataResolver metadataResolver,
        TextExtractor textExtractor,
        TemporalFilter temporalFilter,
        @Qualifier("scanLimiter") RateLimiter scanLimiter
    ) {
        this.reportsRoot = reportsRoot;
        this.metadataResolver = metadataResolver;
        this.textExtractor = textExtractor;
        this.temporalFilter = temporalFilter;
        this.scanLimiter = scanLimiter;
    }

    @Override
    public List<Folder> listFolders(Optional<Instant> cutoff) {
        Path root = reportsRoot.require();
        return scanLimiter.execute(SCAN_LIMIT, 1, () -> scan(root, cutoff));
    }

    public static boolean isPdf(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private List<Folder> scan(Path root, Optional<Instant> cutoff) {
        log.debug("Scanning {} with cutoff {}", root, cutoff.map(Instant::toString).orElse("<none>"));

        List<Folder> folders = new ArrayList<>();
        for (Path directory : listSubdirectories(root)) {
            try {
                folders.add(indexFolder(directory, cutoff));
            } catch (IOException | DirectoryIteratorException e) {
                log.warn("Skipping unreadable folder {}: {}", directory, e.getMessage());
            }
        }

        log.debug("Scan of {} finished: {} folders", root, folders.size());
        return folders;
    }

    private List<Path> listSubdirectories(Path root) {
        List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root,
            p -> Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))) {
            stream.forEach(directories::add);
        } catch (IOException | DirectoryIteratorException e) {
            log.error("Reports root directory {} cannot be read", root, e);
            throw new RootMissingException("Reports root directory cannot be read: " + root);
        }
        directories.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return directories;
    }

    private Folder indexFolder(Path directory, Optional<Instant> cutoff) throws IOException {
        String folderName = directory.getFileName().toString();
        List<Document> documents = new ArrayList<>();

        try (DirectoryStream<Path> stream = openFolder(directory)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                FileMetadata metadata;
                try {
                    metadata = metadataResolver.resolve(file);
                } catch (MetadataUnavailableException e) {
                    log.warn("Skipping {}: {}", file, e.getMessage());
                    continue;
                }
                if (temporalFilter.include(cutoff, metadata.modifiedAt())) {
                    documents.add(new Document(folderName, metadata, file, () -> loadText(file)));
                }
            }
        }

        documents.sort(BY_FILENAME);
        return new Folder(folderName, documents);
    }

    DirectoryStream<Path> openFolder(Path directory) throws IOException {
        return Files.newDirectoryStream(directory, FileSystemFolderIndexer::isPdf);
    }

    private List<String> loadText(Path file) {
        try {
            return textExtractor.extract(Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
