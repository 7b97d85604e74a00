package com.libragraph.salvage.util.buffer;

/**
 * Wraps I/O failures and out-of-range reads against a {@link BinaryData}.
 */
public class BufferAccessException extends RuntimeException {

    private final long offset;
    private final String operation;

    public BufferAccessException(long offset, String operation, Throwable cause) {
        super(operation + " failed at offset " + offset, cause);
        this.offset = offset;
        this.operation = operation;
    }

    public BufferAccessException(long offset, String operation) {
        super(operation + " failed at offset " + offset);
        this.offset = offset;
        this.operation = operation;
    }

    public long offset() {
        return offset;
    }

    public String operation() {
        return operation;
    }
}
