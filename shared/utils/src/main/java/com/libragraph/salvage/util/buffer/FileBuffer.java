package com.libragraph.salvage.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * BinaryData backed by a read-only {@link FileChannel}.
 * Suitable for multi-gigabyte dumps: nothing is loaded up front.
 *
 * <p>Reads use {@link FileChannel#read(ByteBuffer, long)}, which never touches the
 * channel position, so concurrent scanners do not interfere.
 */
public class FileBuffer extends BinaryData {

    private final Path path;
    private final FileChannel channel;
    private final long size;

    public FileBuffer(Path path) throws IOException {
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
        this.size = channel.size();
    }

    public Path path() {
        return path;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    protected int readAt(long pos, byte[] dst, int off, int len) throws IOException {
        if (pos >= size) {
            return -1;
        }
        return channel.read(ByteBuffer.wrap(dst, off, len), pos);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
