package com.libragraph.salvage.core.strings;

import com.libragraph.salvage.core.coverage.ByteRange;
import com.libragraph.salvage.types.StringCategory;

import java.util.Optional;

/**
 * @param offset     where the text starts in the dump
 * @param region     the unclaimed region it was found in
 * @param provenance carved file link, or null before cross-referencing or when none is close
 */
public record StringPoolEntry(long offset, String text, StringCategory category, ByteRange region,
                              Provenance provenance) {

    /** Bytes the string occupies, NUL terminator included. */
    public ByteRange range() {
        return ByteRange.of(offset, text.length() + 1L);
    }

    public Optional<Provenance> linkedFile() {
        return Optional.ofNullable(provenance);
    }

    StringPoolEntry withProvenance(Provenance provenance) {
        return new StringPoolEntry(offset, text, category, region, provenance);
    }
}
