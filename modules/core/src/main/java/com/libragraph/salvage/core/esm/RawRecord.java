package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.core.coverage.ByteRange;

import java.util.List;
import java.util.Optional;

/**
 * A validated main record as found in the dump.
 */
public record RawRecord(long offset, RecordHeader header, List<Subrecord> subrecords) {

    public String tag() {
        return header.tag();
    }

    public int formId() {
        return header.formId();
    }

    /** Bytes the record occupies in the dump, header included. */
    public ByteRange range() {
        return ByteRange.of(offset, RecordHeader.SIZE + header.dataSize());
    }

    public long end() {
        return range().end();
    }

    public Optional<Subrecord> first(String tag) {
        for (Subrecord s : subrecords) {
            if (s.is(tag)) return Optional.of(s);
        }
        return Optional.empty();
    }

    public List<Subrecord> all(String tag) {
        return subrecords.stream().filter(s -> s.is(tag)).toList();
    }

    public Optional<String> editorId() {
        return first("EDID").map(Subrecord::asText).filter(s -> !s.isEmpty());
    }

    public String label() {
        return tag() + " " + FormIds.hex(formId());
    }
}
