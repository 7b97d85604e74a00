package com.libragraph.salvage.core.carve;

import com.libragraph.salvage.core.coverage.ByteRange;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.ContentHash;

import java.util.Optional;

/**
 * A file recovered by signature.
 *
 * @param confidence detection priority of the format that produced it
 * @param name       name embedded in the file itself, or null
 * @param hash       BLAKE3 of the carved bytes
 */
public record CarvedFile(
        long offset,
        long length,
        FileCategory category,
        String formatId,
        int confidence,
        String name,
        ContentHash hash
) {
    public long end() {
        return offset + length;
    }

    public ByteRange range() {
        return ByteRange.of(offset, length);
    }

    public Optional<String> embeddedName() {
        return Optional.ofNullable(name);
    }

    public String label() {
        return String.format("%s@0x%08X", formatId, offset);
    }
}
