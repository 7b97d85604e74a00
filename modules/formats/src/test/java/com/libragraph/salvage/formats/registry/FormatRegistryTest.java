package com.libragraph.salvage.formats.registry;

import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.formats.handlers.BinkFormat;
import com.libragraph.salvage.types.FileCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class FormatRegistryTest {

    @Test
    void shouldOrderByPriorityDescending() {
        List<SignatureFormat> formats = FormatRegistry.builtIn().formats();

        assertThat(formats).extracting(f -> f.getDetectionCriteria().priority())
                .isSortedAccordingTo((a, b) -> Integer.compare(b, a));
        assertThat(formats.get(0).id()).isEqualTo("bink");
    }

    @Test
    void shouldFilterByCategory() {
        List<SignatureFormat> textures = FormatRegistry.builtIn().formatsFor(Set.of(FileCategory.TEXTURE));

        assertThat(textures).extracting(SignatureFormat::id).containsExactly("dds", "ddx");
    }

    @Test
    void shouldTreatEmptyFilterAsAll() {
        FormatRegistry registry = FormatRegistry.builtIn();

        assertThat(registry.formatsFor(Set.of())).hasSize(registry.formats().size());
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new FormatRegistry(List.of(new BinkFormat(), new BinkFormat())))
                .withMessageContaining("bink");
    }

    @Test
    void shouldFindById() {
        assertThat(FormatRegistry.builtIn().findById("png")).isPresent();
        assertThat(FormatRegistry.builtIn().findById("zip")).isEmpty();
    }
}
