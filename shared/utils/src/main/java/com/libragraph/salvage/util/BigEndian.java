package com.libragraph.salvage.util;

/**
 * Big-endian field decoding.
 *
 * <p>Console database records store every multi-byte integer big-endian. Parsers call
 * these methods exactly once per field and keep only the decoded host value; no raw
 * big-endian bytes are retained past this point.
 */
public final class BigEndian {

    private BigEndian() {
    }

    public static int u8(byte[] b, int index) {
        return b[index] & 0xFF;
    }

    public static int u16(byte[] b, int index) {
        return ((b[index] & 0xFF) << 8) | (b[index + 1] & 0xFF);
    }

    /** Unsigned 32-bit value widened to long. */
    public static long u32(byte[] b, int index) {
        return i32(b, index) & 0xFFFFFFFFL;
    }

    public static int i32(byte[] b, int index) {
        return ((b[index] & 0xFF) << 24)
                | ((b[index + 1] & 0xFF) << 16)
                | ((b[index + 2] & 0xFF) << 8)
                | (b[index + 3] & 0xFF);
    }

    public static float f32(byte[] b, int index) {
        return Float.intBitsToFloat(i32(b, index));
    }

    /** Four-character tag as stored, read left to right. */
    public static String tag(byte[] b, int index) {
        char[] chars = new char[4];
        for (int i = 0; i < 4; i++) {
            chars[i] = (char) (b[index + i] & 0xFF);
        }
        return new String(chars);
    }

    /** Four-character tag stored byte-reversed, as big-endian dumps hold it in memory. */
    public static String reversedTag(byte[] b, int index) {
        char[] chars = new char[4];
        for (int i = 0; i < 4; i++) {
            chars[i] = (char) (b[index + 3 - i] & 0xFF);
        }
        return new String(chars);
    }
}
