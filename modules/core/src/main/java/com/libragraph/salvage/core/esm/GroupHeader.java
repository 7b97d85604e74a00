package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.util.BigEndian;

/**
 * A GRUP container header. Groups are recorded for structure; their bodies are scanned
 * as ordinary record territory.
 *
 * @param size      total group size including this header
 * @param label     raw label field; a record tag or a FormID depending on {@code groupType}
 * @param groupType 0 for top-level type groups, 1..10 for nested world, cell and topic groups
 */
public record GroupHeader(long offset, long size, int label, int groupType, int stamp) {

    static final int MAX_GROUP_TYPE = 10;

    static GroupHeader decode(byte[] b, int index, long offset) {
        return new GroupHeader(offset,
                BigEndian.u32(b, index + 4),
                BigEndian.i32(b, index + 8),
                BigEndian.i32(b, index + 12),
                BigEndian.i32(b, index + 16));
    }

    boolean plausible(long available) {
        return size >= RecordHeader.SIZE && size <= available
                && groupType >= 0 && groupType <= MAX_GROUP_TYPE;
    }
}
