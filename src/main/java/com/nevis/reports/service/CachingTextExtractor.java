package com.nevis.reports.service;

import lombok.extern.slf4j.Slf4j;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps extracted pages keyed by the SHA-256 of the file content, so an
 * unchanged PDF is parsed once across scans. Least recently used entries are
 * evicted beyond {@code maxEntries}.
 */
@Slf4j
public class CachingTextExtractor implements TextExtractor {

    private final TextExtractor delegate;
    private final Map<String, List<String>> cache;

    public CachingTextExtractor(TextExtractor delegate, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.delegate = delegate;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<String>> eldest) {
                return size() > maxEntries;
            }
        };
    }

    @Override
    public List<String> extract(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            return delegate.extract(pdfBytes);
        }
        String key = sha256(pdfBytes);
        synchronized (cache) {
            List<String> cached = cache.get(key);
            if (cached != null) {
                log.debug("Text cache hit for {}", key);
                return cached;
            }
        }

        List<String> pages = List.copyOf(delegate.extract(pdfBytes));
        synchronized (cache) {
            cache.put(key, pages);
        }
        return pages;
    }

    int size() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
