package com.libragraph.salvage.util.buffer;

import com.libragraph.salvage.util.ContentHash;
import org.apache.commons.codec.digest.Blake3;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Read-only binary data backed by RAM or a disk file.
 *
 * All reads are positional: there is no shared cursor, so any number of scanners
 * may read the same instance concurrently. Results elsewhere in the code base store
 * offsets and lengths into this arena rather than copies of it.
 *
 * Design principles:
 * - Size is always available
 * - Reads are bounded by the caller (no readAllBytes on the whole arena)
 * - I/O failures surface as {@link BufferAccessException} carrying offset and operation
 */
public abstract class BinaryData implements Closeable {

    private static final int STREAM_CHUNK = 64 * 1024;

    /**
     * Wraps an in-memory byte array. The array is not copied and must not be mutated afterwards.
     */
    public static BinaryData of(byte[] data) {
        return new RamBuffer(data);
    }

    /**
     * Opens a file read-only. The caller owns the returned instance and must close it.
     */
    public static BinaryData open(Path path) {
        try {
            return new FileBuffer(path);
        } catch (IOException e) {
            throw new BufferAccessException(0, "open " + path, e);
        }
    }

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Positional read into {@code dst}. Must not depend on or change any cursor state.
     *
     * @return number of bytes read, or -1 if {@code pos} is at or beyond the end
     */
    protected abstract int readAt(long pos, byte[] dst, int off, int len) throws IOException;

    /**
     * Returns true if {@code [pos, pos + length)} lies entirely inside this data.
     */
    public boolean contains(long pos, long length) {
        return pos >= 0 && length >= 0 && pos <= size() && length <= size() - pos;
    }

    /**
     * Reads up to {@code maxLength} bytes starting at {@code pos}.
     * The result is shorter than requested when the end of the data is reached.
     */
    public byte[] read(long pos, int maxLength) {
        if (pos < 0 || maxLength < 0) {
            throw new IllegalArgumentException("Negative position or length: " + pos + ", " + maxLength);
        }
        long available = Math.max(0, size() - pos);
        int toRead = (int) Math.min(maxLength, available);
        byte[] result = new byte[toRead];
        fill(pos, result, "read");
        return result;
    }

    /**
     * Reads exactly {@code length} bytes starting at {@code pos}.
     *
     * @throws BufferAccessException if the range is not inside this data
     */
    public byte[] readExact(long pos, int length) {
        if (!contains(pos, length)) {
            throw new BufferAccessException(pos, "read " + length + " bytes past end (size " + size() + ")");
        }
        byte[] result = new byte[length];
        fill(pos, result, "read");
        return result;
    }

    /**
     * Finds the first occurrence of {@code pattern} starting in {@code [from, to)}.
     * The match itself may extend past {@code to} but never past the end of the data.
     *
     * @return absolute offset of the match, or -1
     */
    public long indexOf(byte[] pattern, long from, long to) {
        if (pattern.length == 0) return from;
        long end = Math.min(to, size() - pattern.length + 1);
        long chunkStart = Math.max(0, from);
        while (chunkStart < end) {
            int scanLength = (int) Math.min(STREAM_CHUNK, end - chunkStart);
            byte[] window = read(chunkStart, scanLength + pattern.length - 1);
            for (int i = 0; i < scanLength; i++) {
                if (matchesAt(window, i, pattern)) {
                    return chunkStart + i;
                }
            }
            chunkStart += scanLength;
        }
        return -1;
    }

    /**
     * Content hash (BLAKE3-128) of a range, streamed in chunks.
     */
    public ContentHash hash(long pos, long length) {
        if (!contains(pos, length)) {
            throw new BufferAccessException(pos, "hash " + length + " bytes past end (size " + size() + ")");
        }
        Blake3 hasher = Blake3.initHash();
        long cursor = pos;
        long end = pos + length;
        while (cursor < end) {
            byte[] chunk = read(cursor, (int) Math.min(STREAM_CHUNK, end - cursor));
            hasher.update(chunk);
            cursor += chunk.length;
        }
        return new ContentHash(hasher.doFinalize(16));
    }

    /**
     * Content hash (BLAKE3-128) of the whole data.
     */
    public ContentHash hash() {
        return hash(0, size());
    }

    @Override
    public void close() throws IOException {
        // nothing to release by default
    }

    private void fill(long pos, byte[] dst, String operation) {
        int done = 0;
        try {
            while (done < dst.length) {
                int n = readAt(pos + done, dst, done, dst.length - done);
                if (n < 0) {
                    throw new BufferAccessException(pos + done, operation + ": unexpected end of data");
                }
                done += n;
            }
        } catch (IOException e) {
            throw new BufferAccessException(pos + done, operation, e);
        }
    }

    private static boolean matchesAt(byte[] window, int index, byte[] pattern) {
        if (index + pattern.length > window.length) return false;
        for (int j = 0; j < pattern.length; j++) {
            if (window[index + j] != pattern[j]) return false;
        }
        return true;
    }
}
