package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.util.BigEndian;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class RecordTypesTest {

    @Test
    void shouldMatchTagsInBothOrientations() {
        int forward = BigEndian.i32("QUST".getBytes(StandardCharsets.US_ASCII), 0);
        int reversed = BigEndian.i32("TSUQ".getBytes(StandardCharsets.US_ASCII), 0);

        assertThat(RecordTypes.match(forward)).isEqualTo(new RecordTypes.TagMatch("QUST", false));
        assertThat(RecordTypes.match(reversed)).isEqualTo(new RecordTypes.TagMatch("QUST", true));
    }

    @Test
    void shouldIgnoreUnknownAndDebugRegisterTags() {
        for (String tag : new String[]{"VGT_", "SX_D", "SQ_D", "ABCD"}) {
            int key = BigEndian.i32(tag.getBytes(StandardCharsets.US_ASCII), 0);
            assertThat(RecordTypes.match(key)).as(tag).isNull();
        }
    }

    @Test
    void shouldKnowRecordTypesButNotGroups() {
        assertThat(RecordTypes.isKnown("NPC_")).isTrue();
        assertThat(RecordTypes.isKnown("GRUP")).isFalse();
    }
}
