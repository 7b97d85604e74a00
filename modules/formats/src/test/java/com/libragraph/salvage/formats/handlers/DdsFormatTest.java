package com.libragraph.salvage.formats.handlers;

import com.libragraph.salvage.formats.api.Extent;
import com.libragraph.salvage.util.buffer.BinaryData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DdsFormatTest {

    private final DdsFormat format = new DdsFormat();

    @Test
    void shouldComputeSingleLevelDxt1Size() {
        BinaryData data = BinaryData.of(FormatFixtures.place(4096, 0, FormatFixtures.dds(64, 64, 1, "DXT1")));

        // 16 x 16 blocks of 8 bytes + 128-byte header
        assertThat(format.measure(data, 0)).map(Extent::length).contains(16L * 16 * 8 + 128);
    }

    @Test
    void shouldIncludeMipChain() {
        BinaryData data = BinaryData.of(FormatFixtures.place(8192, 0, FormatFixtures.dds(8, 8, 4, "DXT5")));

        // 8x8 -> 4 blocks, 4x4 -> 1, 2x2 -> 1, 1x1 -> 1; 16 bytes each
        assertThat(format.measure(data, 0)).map(Extent::length).contains(7L * 16 + 128);
    }

    @Test
    void shouldRejectZeroDimensions() {
        BinaryData data = BinaryData.of(FormatFixtures.place(4096, 0, FormatFixtures.dds(0, 64, 1, "DXT1")));

        assertThat(format.measure(data, 0)).isEmpty();
    }
}
