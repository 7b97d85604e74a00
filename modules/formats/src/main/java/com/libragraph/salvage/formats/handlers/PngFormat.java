package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * PNG image, scanned forward to the {@code IEND} chunk (plus its CRC).
 */
@ApplicationScoped
public class PngFormat implements SignatureFormat {

    private static final byte[] PNG_MAGIC = new byte[]{(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] IEND = new byte[]{0x49, 0x45, 0x4E, 0x44};
    private static final long MAX_SCAN = 50L * 1024 * 1024;

    private static final DetectionCriteria CRITERIA =
            DetectionCriteria.of(PNG_MAGIC, 8 + 25 + 12, MAX_SCAN + 8, 85);

    @Override
    public String id() {
        return "png";
    }

    @Override
    public FileCategory category() {
        return FileCategory.IMAGE;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public Optional<Extent> measure(BinaryData data, long offset) {
        long iend = data.indexOf(IEND, offset + PNG_MAGIC.length, offset + MAX_SCAN);
        if (iend < 0) {
            return Optional.empty();
        }
        return Optional.of(Extent.of(iend + 8 - offset));
    }
}
