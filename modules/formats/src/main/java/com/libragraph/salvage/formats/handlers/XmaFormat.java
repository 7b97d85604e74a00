package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.LittleEndian;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * XMA audio in a RIFF/WAVE container. Extent is the RIFF size plus the 8-byte chunk header.
 * Plain PCM WAVE files are not claimed; only an {@code XMA2} chunk or an XMA format tag qualifies.
 */
@ApplicationScoped
public class XmaFormat implements SignatureFormat {

    private static final byte[] RIFF_MAGIC = new byte[]{'R', 'I', 'F', 'F'};
    private static final byte[] WAVE = new byte[]{'W', 'A', 'V', 'E'};
    private static final byte[] XMA2_CHUNK = new byte[]{'X', 'M', 'A', '2'};
    private static final byte[] FMT_CHUNK = new byte[]{'f', 'm', 't', ' '};
    private static final int XMA_FORMAT_TAG = 0x0165;
    private static final int XMA2_FORMAT_TAG = 0x0166;
    private static final int CHUNK_SCAN_LIMIT = 200;

    private static final DetectionCriteria CRITERIA =
            DetectionCriteria.of(RIFF_MAGIC, 44, 100L * 1024 * 1024, 80);

    @Override
    public String id() {
        return "xma";
    }

    @Override
    public FileCategory category() {
        return FileCategory.AUDIO;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public Optional<Extent> measure(BinaryData data, long offset) {
        byte[] header = data.read(offset, CHUNK_SCAN_LIMIT);
        if (header.length < 12 || !regionEquals(header, 8, WAVE)) {
            return Optional.empty();
        }
        long fileSize = LittleEndian.u32(header, 4) + 8;
        if (!CRITERIA.acceptsSize(fileSize) || !hasXmaChunk(header)) {
            return Optional.empty();
        }
        return Optional.of(Extent.of(fileSize));
    }

    private static boolean hasXmaChunk(byte[] header) {
        long pos = 12;
        while (pos < header.length - 8) {
            int p = (int) pos;
            if (regionEquals(header, p, XMA2_CHUNK)) {
                return true;
            }
            if (regionEquals(header, p, FMT_CHUNK) && header.length >= p + 10) {
                int formatTag = LittleEndian.u16(header, p + 8);
                if (formatTag == XMA_FORMAT_TAG || formatTag == XMA2_FORMAT_TAG) {
                    return true;
                }
            }
            long chunkSize = LittleEndian.u32(header, p + 4);
            pos += 8 + ((chunkSize + 1) & ~1L);
        }
        return false;
    }

    static boolean regionEquals(byte[] data, int index, byte[] expected) {
        if (index < 0 || index + expected.length > data.length) return false;
        for (int i = 0; i < expected.length; i++) {
            if (data[index + i] != expected[i]) return false;
        }
        return true;
    }
}
