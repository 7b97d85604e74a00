package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.BigEndian;
import com.libragraph.salvage.util.LittleEndian;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

/**
 * Xbox 360 DDX texture ({@code 3XDO} / {@code 3XDR}).
 *
 * <p>The payload is XMemCompress data with no stored length, so the extent is an estimate:
 * the next valid DDX header inside the plausible compressed-size window bounds it, otherwise
 * a typical compression ratio of the uncompressed mip chain is assumed. Confidence is lower
 * than for formats with a declared length.
 */
@ApplicationScoped
public class DdxFormat implements SignatureFormat {

    private static final byte[] DDX_MAGIC_3XDO = new byte[]{'3', 'X', 'D', 'O'};
    private static final byte[] DDX_MAGIC_3XDR = new byte[]{'3', 'X', 'D', 'R'};
    private static final int HEADER_SIZE = 0x44;
    private static final int MAX_DIMENSION = 4096;
    private static final int OVERLAP_MARGIN = 0x8000;

    private static final DetectionCriteria CRITERIA = new DetectionCriteria(
            List.of(DDX_MAGIC_3XDO, DDX_MAGIC_3XDR), 0, HEADER_SIZE, 64L * 1024 * 1024, 60);

    @Override
    public String id() {
        return "ddx";
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
        if (!isPlausibleHeader(header, 3, Integer.MAX_VALUE, false)) {
            return Optional.empty();
        }

        long formatWord = BigEndian.u32(header, 0x28);
        long sizeWord = BigEndian.u32(header, 0x2C);
        int width = (int) (sizeWord & 0x1FFF) + 1;
        int height = (int) ((sizeWord >> 13) & 0x1FFF) + 1;
        int mipCount = (int) ((formatWord >> 16) & 0xF) + 1;
        if (mipCount > 13) mipCount = 1;
        int gpuFormat = (int) (formatWord & 0xFF);

        long uncompressed = TextureMath.mipChainSize(width, height, mipCount, bytesPerBlock(gpuFormat));
        return Optional.of(Extent.of(estimateLength(data, offset, uncompressed)));
    }

    private long estimateLength(BinaryData data, long offset, long uncompressed) {
        long minCompressed = Math.max(100, uncompressed * 2 / 5);
        long minSize = HEADER_SIZE + minCompressed;
        long maxSize = Math.min(data.size() - offset, HEADER_SIZE + uncompressed + 512);

        long searchFrom = offset + minSize;
        long searchTo = offset + maxSize;
        while (searchFrom < searchTo) {
            long next = nearest(data.indexOf(DDX_MAGIC_3XDO, searchFrom, searchTo),
                    data.indexOf(DDX_MAGIC_3XDR, searchFrom, searchTo));
            if (next < 0) break;
            if (isPlausibleHeader(data.read(next, HEADER_SIZE), 3, 10, true)) {
                return Math.min(next - offset + OVERLAP_MARGIN, maxSize);
            }
            searchFrom = next + 1;
        }
        return HEADER_SIZE + Math.max(minCompressed, uncompressed * 7 / 10);
    }

    private static boolean isPlausibleHeader(byte[] header, int minVersion, int maxVersion, boolean requirePowerOfTwo) {
        if (header.length < HEADER_SIZE) return false;
        int version = LittleEndian.u16(header, 7);
        if (version < minVersion || version > maxVersion) return false;
        if ((header[0x04] & 0xFF) == 0xFF) return false;
        if ((header[0x24] & 0xFF) < 0x80) return false;

        long sizeWord = BigEndian.u32(header, 0x2C);
        int width = (int) (sizeWord & 0x1FFF) + 1;
        int height = (int) ((sizeWord >> 13) & 0x1FFF) + 1;
        if (width > MAX_DIMENSION || height > MAX_DIMENSION) return false;
        return !requirePowerOfTwo || (TextureMath.isPowerOfTwo(width) && TextureMath.isPowerOfTwo(height));
    }

    private static long nearest(long a, long b) {
        if (a < 0) return b;
        if (b < 0) return a;
        return Math.min(a, b);
    }

    private static int bytesPerBlock(int gpuFormat) {
        return switch (gpuFormat) {
            case 0x52, 0x7B -> 8;  // DXT1, DXT5A
            default -> 16;
        };
    }
}
