package com.nevis.reports.service;

import com.nevis.reports.exception.RootMissingException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The directory whose immediate subdirectories are the report folders. It is
 * checked on every call so a root created or fixed later is picked up without
 * a restart.
 */
@Slf4j
public class ReportsRoot {

    private final Path root;

    public ReportsRoot(Path root) {
        this.root = root == null ? null : root.toAbsolutePath().normalize();
    }

    public Path require() {
        if (root == null) {
            log.error("Reports root directory is not configured (app.reports.root)");
            throw new RootMissingException("Reports root directory is not configured");
        }
        if (!Files.isDirectory(root)) {
            log.error("Reports root directory {} does not exist", root);
            throw new RootMissingException("Reports root directory does not exist: " + root);
        }
        return root;
    }
}
