package com.libragraph.salvage.core.fixtures;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.zip.Deflater;

/**
 * Builds big-endian ESM records byte by byte for tests.
 */
public final class EsmBlobBuilder {

    public static final int COMPRESSED = 0x00040000;

    private final String tag;
    private final int formId;
    private final ByteArrayOutputStream payload = new ByteArrayOutputStream();
    private int flags;
    private boolean reversed;
    private boolean compressed;
    private Long declaredSize;

    private EsmBlobBuilder(String tag, int formId) {
        this.tag = tag;
        this.formId = formId;
    }

    public static EsmBlobBuilder record(String tag, int formId) {
        return new EsmBlobBuilder(tag, formId);
    }

    public EsmBlobBuilder text(String subTag, String value) {
        byte[] text = value.getBytes(StandardCharsets.ISO_8859_1);
        byte[] data = new byte[text.length + 1];
        System.arraycopy(text, 0, data, 0, text.length);
        return subrecord(subTag, data);
    }

    /** Text padded with NULs to exactly {@code length} bytes. */
    public EsmBlobBuilder paddedText(String subTag, String value, int length) {
        byte[] data = new byte[length];
        byte[] text = value.getBytes(StandardCharsets.ISO_8859_1);
        System.arraycopy(text, 0, data, 0, text.length);
        return subrecord(subTag, data);
    }

    public EsmBlobBuilder formId(String subTag, int id) {
        return ints(subTag, id);
    }

    public EsmBlobBuilder ints(String subTag, int... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * 4);
        for (int v : values) buf.putInt(v);
        return subrecord(subTag, buf.array());
    }

    public EsmBlobBuilder floats(String subTag, float... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * 4);
        for (float v : values) buf.putFloat(v);
        return subrecord(subTag, buf.array());
    }

    public EsmBlobBuilder shorts(String subTag, int... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * 2);
        for (int v : values) buf.putShort((short) v);
        return subrecord(subTag, buf.array());
    }

    /** Writes an {@code XXXX} size subrecord first when the payload does not fit a u16 length. */
    public EsmBlobBuilder subrecord(String subTag, byte[] data) {
        if (data.length > 0xFFFF) {
            writeSubrecordHeader("XXXX", 4);
            payload.writeBytes(ByteBuffer.allocate(4).putInt(data.length).array());
            writeSubrecordHeader(subTag, 0);
        } else {
            writeSubrecordHeader(subTag, data.length);
        }
        payload.writeBytes(data);
        return this;
    }

    /** Stores every tag of the record byte-reversed. Must be called before adding subrecords. */
    public EsmBlobBuilder reversedTags() {
        this.reversed = true;
        return this;
    }

    public EsmBlobBuilder compressed() {
        this.compressed = true;
        return this;
    }

    public EsmBlobBuilder flags(int flags) {
        this.flags = flags;
        return this;
    }

    /** Overrides the header data size, e.g. to make it run past the buffer. */
    public EsmBlobBuilder declaredSize(long size) {
        this.declaredSize = size;
        return this;
    }

    public byte[] payload() {
        return payload.toByteArray();
    }

    public byte[] build() {
        byte[] body = payload.toByteArray();
        if (compressed) {
            body = deflate(body);
        }
        ByteBuffer header = ByteBuffer.allocate(24);
        header.put(tagBytes(tag));
        header.putInt((int) (declaredSize != null ? declaredSize : body.length));
        header.putInt(flags | (compressed ? COMPRESSED : 0));
        header.putInt(formId);
        header.putInt(0);
        header.putShort((short) 15);
        header.putShort((short) 0);

        byte[] out = new byte[24 + body.length];
        System.arraycopy(header.array(), 0, out, 0, 24);
        System.arraycopy(body, 0, out, 24, body.length);
        return out;
    }

    /**
     * A GRUP header (type 0, label = record tag) followed by its contents.
     */
    public static byte[] group(String label, byte[]... contents) {
        int size = 24;
        for (byte[] c : contents) size += c.length;
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put("GRUP".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(size);
        buf.put(label.getBytes(StandardCharsets.US_ASCII));
        buf.putInt(0);
        buf.putInt(0);
        buf.putInt(0);
        for (byte[] c : contents) buf.put(c);
        return buf.array();
    }

    private void writeSubrecordHeader(String subTag, int length) {
        payload.writeBytes(tagBytes(subTag));
        payload.write((length >>> 8) & 0xFF);
        payload.write(length & 0xFF);
    }

    private byte[] tagBytes(String t) {
        byte[] b = t.getBytes(StandardCharsets.US_ASCII);
        if (reversed) {
            return new byte[]{b[3], b[2], b[1], b[0]};
        }
        return b;
    }

    private static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(ByteBuffer.allocate(4).putInt(data.length).array());
        byte[] chunk = new byte[4096];
        while (!deflater.finished()) {
            int n = deflater.deflate(chunk);
            out.write(chunk, 0, n);
        }
        deflater.end();
        return out.toByteArray();
    }
}
