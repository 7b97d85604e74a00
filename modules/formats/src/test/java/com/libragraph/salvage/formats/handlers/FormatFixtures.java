package com.libragraph.salvage.formats.handlers;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Byte-level builders for synthetic format headers.
 */
final class FormatFixtures {

    private FormatFixtures() {
    }

    static byte[] bink(int declaredSize) {
        ByteBuffer buf = ByteBuffer.allocate(32).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("BIKi".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(declaredSize);
        return buf.array();
    }

    static byte[] dds(int width, int height, int mipCount, String fourCc) {
        ByteBuffer buf = ByteBuffer.allocate(128).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("DDS ".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(4, 124);
        buf.putInt(12, height);
        buf.putInt(16, width);
        buf.putInt(28, mipCount);
        buf.position(84);
        buf.put(fourCc.getBytes(StandardCharsets.US_ASCII));
        return buf.array();
    }

    static byte[] xma(int riffSize) {
        ByteBuffer buf = ByteBuffer.allocate(64).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(riffSize);
        buf.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        buf.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(20);
        buf.putShort((short) 0x0166);
        return buf.array();
    }

    /**
     * Single-level DDX header. {@code gpuFormat} 0x52 is DXT1 (8 bytes per block).
     */
    static byte[] ddx(String magic, int width, int height, int gpuFormat) {
        ByteBuffer buf = ByteBuffer.allocate(0x44).order(ByteOrder.BIG_ENDIAN);
        buf.put(magic.getBytes(StandardCharsets.US_ASCII));
        buf.put(7, (byte) 3);
        buf.put(0x24, (byte) 0x80);
        buf.putInt(0x28, gpuFormat);
        buf.putInt(0x2C, (width - 1) | ((height - 1) << 13));
        return buf.array();
    }

    /**
     * NIF header line followed by {@code tail} as raw bytes.
     */
    static byte[] nif(String version, byte[] tail) {
        byte[] line = ("Gamebryo File Format, Version " + version + "\n").getBytes(StandardCharsets.US_ASCII);
        byte[] out = new byte[Math.max(128, line.length + tail.length)];
        System.arraycopy(line, 0, out, 0, line.length);
        System.arraycopy(tail, 0, out, line.length, tail.length);
        return out;
    }

    static byte[] place(byte[] data, int offset, byte[] content) {
        System.arraycopy(content, 0, data, offset, content.length);
        return data;
    }

    static byte[] place(int total, int offset, byte[] content) {
        byte[] data = new byte[total];
        System.arraycopy(content, 0, data, offset, content.length);
        return data;
    }
}
