package com.libragraph.salvage.core.strings;

import com.libragraph.salvage.types.StringCategory;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class StringClassifierTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "meshes\\clutter\\bottle.nif          | FILE_PATH",
            "textures/armor/leather.dds          | FILE_PATH",
            "Sound\\fx\\ui\\menu_ok.wav           | FILE_PATH",
            "scripts\\quest                       | FILE_PATH",
            "fCombatDistance                     | GAME_SETTING",
            "iMaxPlayerLevel                     | GAME_SETTING",
            "bUseVoice                           | GAME_SETTING",
            "TestQuest                           | EDITOR_ID",
            "VMS01Caravan_Guard                  | EDITOR_ID",
            "I woke up in Goodsprings after being shot. | DIALOGUE_LINE",
            "12345678                            | OTHER",
            "ABCDEFGH                            | OTHER",
    })
    void shouldClassify(String text, StringCategory expected) {
        assertThat(StringClassifier.classify(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Loading Level 4 Cells for the current world space",
            "WARNING the texture pool is running out of memory",
            "Allocated 0x4000 bytes for the havok world here",
    })
    void shouldNotTreatTechnicalMessagesAsDialogue(String text) {
        assertThat(StringClassifier.classify(text)).isNotEqualTo(StringCategory.DIALOGUE_LINE);
    }

    @ParameterizedTest
    @CsvSource({"fAb", "fAbcdef", "fAbcdefgh", "fABCDEFGh", "xAbcdEfgh"})
    void shouldRejectMalformedGameSettings(String text) {
        assertThat(StringClassifier.isGameSetting(text)).isFalse();
    }
}
