package com.libragraph.salvage.util.buffer;

/**
 * BinaryData over an in-memory byte array.
 * Suitable for test fixtures and dumps that fit comfortably on the heap (arrays cap at 2 GB).
 */
public class RamBuffer extends BinaryData {
    private final byte[] data;

    public RamBuffer(byte[] data) {
        this.data = data;
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    protected int readAt(long pos, byte[] dst, int off, int len) {
        if (pos >= data.length) {
            return -1;  // EOF
        }
        int toRead = (int) Math.min(len, data.length - pos);
        System.arraycopy(data, (int) pos, dst, off, toRead);
        return toRead;
    }
}
