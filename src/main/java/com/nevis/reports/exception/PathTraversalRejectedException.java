package com.nevis.reports.exception;

/**
 * A folder/filename pair that would resolve outside the reports root. Reported
 * to callers as a plain not-found.
 */
public class PathTraversalRejectedException extends EntityNotFoundException {

    public PathTraversalRejectedException(String folder, String filename) {
        super("Document not found: " + folder + "/" + filename);
    }
}
