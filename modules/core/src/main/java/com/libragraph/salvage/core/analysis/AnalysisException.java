package com.libragraph.salvage.core.analysis;

/**
 * Fatal failure of an analysis call: the buffer could not be read or addressed.
 * Structural problems in the data are never reported this way.
 */
public class AnalysisException extends RuntimeException {

    private final long offset;
    private final String operation;

    public AnalysisException(long offset, String operation, String message, Throwable cause) {
        super(message, cause);
        this.offset = offset;
        this.operation = operation;
    }

    public AnalysisException(long offset, String operation, String message) {
        this(offset, operation, message, null);
    }

    /** Offset being accessed when the failure happened, or -1 if not tied to a position. */
    public long offset() {
        return offset;
    }

    public String operation() {
        return operation;
    }
}
