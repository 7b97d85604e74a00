package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.util.BigEndian;

import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

/**
 * One tagged field of a record.
 *
 * @param offset position of the subrecord header within the (decompressed) record payload
 */
public record Subrecord(String tag, int offset, byte[] data) {

    public int length() {
        return data.length;
    }

    public boolean is(String tag) {
        return this.tag.equals(tag);
    }

    /** Text up to the first NUL, or the whole payload when unterminated. */
    public String asText() {
        int end = 0;
        while (end < data.length && data[end] != 0) end++;
        return new String(data, 0, end, StandardCharsets.ISO_8859_1);
    }

    /** Leading FormID, when the payload is long enough to hold one. */
    public OptionalInt formId() {
        return data.length >= 4 ? OptionalInt.of(BigEndian.i32(data, 0)) : OptionalInt.empty();
    }

    public int u8(int index) {
        return BigEndian.u8(data, index);
    }

    public int u16(int index) {
        return BigEndian.u16(data, index);
    }

    public short i16(int index) {
        return (short) BigEndian.u16(data, index);
    }

    public int i32(int index) {
        return BigEndian.i32(data, index);
    }

    public float f32(int index) {
        return BigEndian.f32(data, index);
    }
}
