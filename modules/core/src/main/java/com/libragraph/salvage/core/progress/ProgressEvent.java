package com.libragraph.salvage.core.progress;

/**
 * Coarse progress notification.
 *
 * @param itemsProcessed   bytes or records processed so far
 * @param totalItems       total, or 0 if unknown
 * @param currentItemLabel phase or item being processed
 * @param terminal         true only for the last event of an entry point
 * @param success          meaningful when {@code terminal}
 * @param error            failure message when a terminal event reports failure, otherwise null
 */
public record ProgressEvent(
        long itemsProcessed,
        long totalItems,
        String currentItemLabel,
        String message,
        boolean terminal,
        boolean success,
        String error
) {
    public static ProgressEvent progress(long processed, long total, String label, String message) {
        return new ProgressEvent(processed, total, label, message, false, false, null);
    }

    public static ProgressEvent completed(long processed, long total, String label, String message) {
        return new ProgressEvent(processed, total, label, message, true, true, null);
    }

    public static ProgressEvent failed(String label, String error) {
        return new ProgressEvent(0, 0, label, "failed", true, false, error);
    }
}
