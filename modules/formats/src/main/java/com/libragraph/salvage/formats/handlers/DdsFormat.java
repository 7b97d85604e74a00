package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.BigEndian;
import com.libragraph.salvage.util.LittleEndian;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * DirectDraw Surface texture. The extent is computed from the header dimensions,
 * mip count and block format. Console dumps may hold the header fields big-endian;
 * little-endian is tried first.
 */
@ApplicationScoped
public class DdsFormat implements SignatureFormat {

    private static final byte[] DDS_MAGIC = new byte[]{'D', 'D', 'S', ' '};
    private static final int HEADER_SIZE = 128;
    private static final int DECLARED_HEADER_SIZE = 124;
    private static final int MAX_DIMENSION = 16384;

    private static final DetectionCriteria CRITERIA =
            DetectionCriteria.of(DDS_MAGIC, HEADER_SIZE, 512L * 1024 * 1024, 70);

    @Override
    public String id() {
        return "dds";
    }

    @Override
    public FileCategory category() {
        return FileCategory.TEXTURE;
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

        long declaredHeader = LittleEndian.u32(header, 4);
        long height = LittleEndian.u32(header, 12);
        long width = LittleEndian.u32(header, 16);
        long mipCount = LittleEndian.u32(header, 28);

        if (height > MAX_DIMENSION || width > MAX_DIMENSION || declaredHeader != DECLARED_HEADER_SIZE) {
            height = BigEndian.u32(header, 12);
            width = BigEndian.u32(header, 16);
            mipCount = BigEndian.u32(header, 28);
        }
        if (height == 0 || width == 0 || height > MAX_DIMENSION || width > MAX_DIMENSION) {
            return Optional.empty();
        }

        String fourCc = new String(header, 84, 4, StandardCharsets.US_ASCII).replace("\0", "");
        long pixels = TextureMath.mipChainSize((int) width, (int) height,
                (int) Math.min(mipCount, 16), bytesPerBlock(fourCc));
        long total = pixels + HEADER_SIZE;
        if (!CRITERIA.acceptsSize(total)) {
            return Optional.empty();
        }
        return Optional.of(Extent.of(total));
    }

    private static int bytesPerBlock(String fourCc) {
        return switch (fourCc) {
            case "DXT1", "ATI1", "BC4U", "BC4S" -> 8;
            default -> 16;
        };
    }
}
