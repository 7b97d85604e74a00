package com.libragraph.salvage.util;

/**
 * Little-endian field decoding for container formats (Bink, RIFF, DDS) that keep
 * PC byte order even on the console.
 */
public final class LittleEndian {

    private LittleEndian() {
    }

    public static int u16(byte[] b, int index) {
        return (b[index] & 0xFF) | ((b[index + 1] & 0xFF) << 8);
    }

    public static long u32(byte[] b, int index) {
        return ((b[index] & 0xFFL))
                | ((b[index + 1] & 0xFFL) << 8)
                | ((b[index + 2] & 0xFFL) << 16)
                | ((b[index + 3] & 0xFFL) << 24);
    }
}
