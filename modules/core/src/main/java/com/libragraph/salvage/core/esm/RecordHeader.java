package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.util.BigEndian;

/**
 * Decoded 24-byte main record header. All fields are host values.
 *
 * @param reversed tag was stored byte-reversed; subrecord tags of the record are too
 */
public record RecordHeader(
        String tag,
        long dataSize,
        int flags,
        int formId,
        long revision,
        int version,
        boolean reversed
) {
    public static final int SIZE = 24;

    public static final int FLAG_COMPRESSED = 0x00040000;
    static final int FLAG_RESERVED_MASK = 0xFFF00000;

    static RecordHeader decode(byte[] b, int index, String tag, boolean reversed) {
        return new RecordHeader(
                tag,
                BigEndian.u32(b, index + 4),
                BigEndian.i32(b, index + 8),
                BigEndian.i32(b, index + 12),
                BigEndian.u32(b, index + 16),
                BigEndian.u16(b, index + 20),
                reversed);
    }

    public boolean compressed() {
        return (flags & FLAG_COMPRESSED) != 0;
    }
}
