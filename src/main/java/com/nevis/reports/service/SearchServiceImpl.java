package com.nevis.reports.service;

import com.nevis.reports.config.ReportsProperties;
import com.nevis.reports.exception.WrongQueryException;
import com.nevis.reports.model.Document;
import com.nevis.reports.model.Folder;
import com.nevis.reports.model.ScanCriteria;
import com.nevis.reports.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Case-insensitive literal search over filenames and page text. Every
 * non-overlapping occurrence counts once; documents are matched in parallel
 * and ranked by match count, then filename.
 */
@Slf4j
@Service
public class SearchServiceImpl implements SearchService {

    public static final String FILENAME_LABEL = "Filename";
    public static final String ELLIPSIS = "...";

    private static final int MAX_QUERY_LENGTH = 500;

    static final Comparator<SearchResult> RANKING = Comparator
        .comparingInt(SearchResult::matchCount).reversed()
        .thenComparing(r -> r.document().getFilename())
        .thenComparing(r -> r.document().getFolder());

    private final FolderIndexer folderIndexer;
    private final Executor extractionExecutor;
    private final int snippetRadius;
    private final int maxSnippetsPerDocument;

    public SearchServiceImpl(
        FolderIndexer folderIndexer,
        @Qualifier("extractionTaskExecutor") Executor extractionExecutor,
        ReportsProperties properties
    ) {
        this.folderIndexer = folderIndexer;
        this.extractionExecutor = extractionExecutor;
        this.snippetRadius = properties.snippetRadius();
        this.maxSnippetsPerDocument = properties.maxSnippetsPerDocument();
    }

    @Override
    public List<SearchResult> search(ScanCriteria criteria) {
        Optional<String> query = criteria.query().map(String::trim).filter(q -> !q.isEmpty());
        if (query.isEmpty()) {
            return List.of();
        }
        String term = query.get();
        if (term.length() > MAX_QUERY_LENGTH) {
            throw new WrongQueryException("Query too long");
        }

        log.debug("Searching for '{}' with cutoff {}", term, criteria.cutoff());

        List<CompletableFuture<Optional<SearchResult>>> pending = folderIndexer.listFolders(criteria.cutoff())
            .stream()
            .map(Folder::documents)
            .flatMap(List::stream)
            .map(doc -> CompletableFuture.supplyAsync(() -> match(doc, term), extractionExecutor))
            .toList();

        List<SearchResult> results = pending.stream()
            .map(CompletableFuture::join)
            .flatMap(Optional::stream)
            .sorted(RANKING)
            .toList();

        log.debug("Query '{}' matched {} of {} documents", term, results.size(), pending.size());
        return results;
    }

    Optional<SearchResult> match(Document document, String term) {
        List<String> matches = new ArrayList<>();
        int matchCount = 0;

        if (indexOfIgnoreCase(document.getFilename(), term, 0) >= 0) {
            matches.add(FILENAME_LABEL + ": " + document.getFilename());
            matchCount++;
        }

        int snippets = 0;
        List<String> pages = document.getExtractedText();
        for (int page = 0; page < pages.size(); page++) {
            String text = pages.get(page);
            int from = 0;
            int position;
            while ((position = indexOfIgnoreCase(text, term, from)) >= 0) {
                matchCount++;
                if (snippets < maxSnippetsPerDocument) {
                    matches.add("Page " + (page + 1) + ": " + snippet(text, position, term.length()));
                    snippets++;
                }
                from = position + term.length();
            }
        }

        if (matchCount == 0) {
            return Optional.empty();
        }
        return Optional.of(new SearchResult(document, matches, matchCount));
    }

    String snippet(String text, int position, int length) {
        int start = Math.max(0, position - snippetRadius);
        int end = Math.min(text.length(), position + length + snippetRadius);

        StringBuilder snippet = new StringBuilder();
        if (start > 0) {
            snippet.append(ELLIPSIS);
        }
        snippet.append(text.substring(start, end).replaceAll("\\s+", " ").strip());
        if (end < text.length()) {
            snippet.append(ELLIPSIS);
        }
        return snippet.toString();
    }

    static int indexOfIgnoreCase(String text, String term, int from) {
        int last = text.length() - term.length();
        for (int i = Math.max(from, 0); i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }
}
