package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.DetectionCriteria;
import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.types.FileCategory;
import com.libragraph.salvage.util.LittleEndian;
import com.libragraph.salvage.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Gamebryo NIF model. NIF headers carry no total size; for 20.x files the extent is
 * estimated from the block count, otherwise a fixed default is assumed. Lowest confidence
 * of the built-in formats.
 */
@ApplicationScoped
public class NifFormat implements SignatureFormat {

    private static final byte[] NIF_MAGIC = "Gamebryo File Format".getBytes(StandardCharsets.US_ASCII);
    private static final int HEADER_SCAN = 128;
    private static final int VERSION_OFFSET = 22;
    private static final int VERSION_SCAN = 40;
    private static final long DEFAULT_SIZE = 50_000;
    private static final long MAX_ESTIMATE = 20L * 1024 * 1024;

    private static final DetectionCriteria CRITERIA =
            DetectionCriteria.of(NIF_MAGIC, 64, MAX_ESTIMATE, 40);

    @Override
    public String id() {
        return "nif";
    }

    @Override
    public FileCategory category() {
        return FileCategory.MODEL;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public Optional<Extent> measure(BinaryData data, long offset) {
        byte[] header = data.read(offset, HEADER_SCAN);
        if (header.length < 64) {
            return Optional.empty();
        }

        int terminator = -1;
        int scanEnd = Math.min(VERSION_OFFSET + VERSION_SCAN, header.length);
        for (int i = VERSION_OFFSET; i < scanEnd; i++) {
            if (header[i] == 0x00 || header[i] == 0x0A) {
                terminator = i;
                break;
            }
        }
        if (terminator < 0) {
            return Optional.empty();
        }

        String version = new String(header, VERSION_OFFSET, terminator - VERSION_OFFSET, StandardCharsets.US_ASCII);
        long estimate = DEFAULT_SIZE;
        if (version.contains("20.")) {
            int limit = Math.min(terminator + 1 + 60, header.length - 4);
            for (int p = terminator + 1; p < limit; p += 4) {
                long blocks = LittleEndian.u32(header, p);
                if (blocks >= 1 && blocks <= 10_000) {
                    estimate = Math.min(blocks * 500 + 1000, MAX_ESTIMATE);
                    break;
                }
            }
        }
        return Optional.of(Extent.of(estimate));
    }
}
