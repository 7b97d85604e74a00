package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.BigEndian;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

/**
 * XUI interface resource ({@code XUIS} scene / {@code XUIB} binary). Header fields are
 * big-endian; the total size sits at +14. An implausible size falls back to scanning for
 * the next resource of the same kind.
 */
@ApplicationScoped
public class XuiFormat implements SignatureFormat {

    private static final byte[] XUI_SCENE_MAGIC = new byte[]{'X', 'U', 'I', 'S'};
    private static final byte[] XUI_BINARY_MAGIC = new byte[]{'X', 'U', 'I', 'B'};
    private static final int HEADER_SIZE = 20;
    private static final long MAX_DECLARED = 10L * 1024 * 1024;
    private static final long BOUNDARY_MIN = 128;
    private static final long BOUNDARY_SCAN = 5L * 1024 * 1024;
    private static final long BOUNDARY_DEFAULT = 64 * 1024;

    private static final DetectionCriteria CRITERIA = new DetectionCriteria(
            List.of(XUI_SCENE_MAGIC, XUI_BINARY_MAGIC), 0, HEADER_SIZE, MAX_DECLARED, 75);

    @Override
    public String id() {
        return "xui";
    }

    @Override
    public FileCategory category() {
        return FileCategory.INTERFACE;
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
        long declared = BigEndian.u32(header, 14);
        if (declared >= HEADER_SIZE && declared <= MAX_DECLARED) {
            return Optional.of(Extent.of(declared));
        }

        byte[] ownMagic = header[3] == 'S' ? XUI_SCENE_MAGIC : XUI_BINARY_MAGIC;
        long next = data.indexOf(ownMagic, offset + BOUNDARY_MIN, offset + BOUNDARY_SCAN);
        return Optional.of(Extent.of(next > 0 ? next - offset : BOUNDARY_DEFAULT));
    }
}
