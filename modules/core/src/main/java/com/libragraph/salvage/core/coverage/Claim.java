package com.libragraph.salvage.core.coverage;

import com.libragraph.salvage.types.CoverageKind;

/**
 * A byte range attributed to one recognized artifact.
 *
 * @param label human-readable attribution, e.g. {@code "dds@0x00001000"} or {@code "QUST 0x00012345"}
 */
public record Claim(ByteRange range, CoverageKind kind, String label) {

    public long start() {
        return range.start();
    }

    public long end() {
        return range.end();
    }

    Claim slice(long start, long end) {
        return new Claim(new ByteRange(start, end), kind, label);
    }
}
