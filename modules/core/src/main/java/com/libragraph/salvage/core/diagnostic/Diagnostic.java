package com.libragraph.salvage.core.diagnostic;

/**
 * A single anomaly observed during analysis. Never fatal.
 *
 * @param component scanner that observed it ({@code carve}, {@code esm}, ...)
 * @param offset    absolute offset in the dump, or -1 when not tied to a position
 */
public record Diagnostic(String component, DiagnosticKind kind, long offset, String message) {

    @Override
    public String toString() {
        return offset >= 0
                ? String.format("[%s] %s @0x%08X: %s", component, kind, offset, message)
                : String.format("[%s] %s: %s", component, kind, message);
    }
}
