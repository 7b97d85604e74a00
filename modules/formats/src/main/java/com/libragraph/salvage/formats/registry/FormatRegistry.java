package com.libragraph.salvage.formats.registry;

import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.formats.handlers.*;
import com.libragraph.salvage.types.FileCategory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Central registry of carvable signature formats.
 * All {@link SignatureFormat} beans are discovered via CDI; {@link #builtIn()} gives the
 * same set outside a container.
 *
 * <p>Formats are held in a fixed order (priority descending, then id) so that every scan
 * over the registry is deterministic.
 */
@ApplicationScoped
public class FormatRegistry {

    private static final Logger log = Logger.getLogger(FormatRegistry.class);

    private static final Comparator<SignatureFormat> ORDER = Comparator
            .comparingInt((SignatureFormat f) -> f.getDetectionCriteria().priority()).reversed()
            .thenComparing(SignatureFormat::id);

    private final List<SignatureFormat> formats;

    @Inject
    public FormatRegistry(Instance<SignatureFormat> discovered) {
        this(discovered.stream().toList());
    }

    public FormatRegistry(List<SignatureFormat> formats) {
        Set<String> ids = new HashSet<>();
        for (SignatureFormat format : formats) {
            if (!ids.add(format.id())) {
                throw new IllegalArgumentException("Duplicate signature format id: " + format.id());
            }
        }
        this.formats = formats.stream().sorted(ORDER).toList();
        log.debugf("Registered %d signature formats: %s", this.formats.size(), ids);
    }

    /**
     * Registry with every built-in format, for use outside a CDI container.
     */
    public static FormatRegistry builtIn() {
        return new FormatRegistry(List.of(
                new BinkFormat(),
                new DdsFormat(),
                new DdxFormat(),
                new NifFormat(),
                new PngFormat(),
                new ScriptFormat(),
                new XmaFormat(),
                new XuiFormat()
        ));
    }

    public List<SignatureFormat> formats() {
        return formats;
    }

    /**
     * Formats whose category is in {@code categories}. An empty filter selects every format.
     */
    public List<SignatureFormat> formatsFor(Set<FileCategory> categories) {
        if (categories.isEmpty()) {
            return formats;
        }
        return formats.stream()
                .filter(f -> categories.contains(f.category()))
                .toList();
    }

    public Optional<SignatureFormat> findById(String id) {
        return formats.stream()
                .filter(f -> f.id().equals(id))
                .findFirst();
    }
}
