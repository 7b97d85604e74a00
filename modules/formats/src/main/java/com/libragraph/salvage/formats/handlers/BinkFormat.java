package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.LittleEndian;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

/**
 * Bink video. The header carries the total file size as a little-endian u32 at +4.
 */
@ApplicationScoped
public class BinkFormat implements SignatureFormat {

    private static final byte[] BINK_MAGIC = new byte[]{'B', 'I', 'K', 'i'};
    private static final byte[] BINK_LEGACY_MAGIC = new byte[]{'B', 'I', 'K', 0x00};
    private static final int HEADER_SIZE = 20;
    private static final long MAX_SIZE = 500L * 1024 * 1024;

    private static final DetectionCriteria CRITERIA = new DetectionCriteria(
            List.of(BINK_MAGIC, BINK_LEGACY_MAGIC), 0, HEADER_SIZE, MAX_SIZE, 90);

    @Override
    public String id() {
        return "bink";
    }

    @Override
    public FileCategory category() {
        return FileCategory.VIDEO;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public Optional<Extent> measure(BinaryData data, long offset) {
        byte[] header = data.read(offset, HEADER_SIZE);
        if (header.length < HEADER_SIZE) {
            return Optional.empty();
        }
        long declared = LittleEndian.u32(header, 4);
        if (!CRITERIA.acceptsSize(declared)) {
            return Optional.empty();
        }
        return Optional.of(Extent.of(declared));
    }
}
