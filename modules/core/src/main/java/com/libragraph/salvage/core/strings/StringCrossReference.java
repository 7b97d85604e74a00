package com.libragraph.salvage.core.strings;

import com.libragraph.salvage.core.carve.CarvedFile;
import com.libragraph.salvage.types.StringCategory;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Links strings to carved files: file paths by name first, then any string by proximity.
 */
public final class StringCrossReference {

    private static final Logger log = Logger.getLogger(StringCrossReference.class);

    private StringCrossReference() {
    }

    public static StringPool link(StringPool pool, List<CarvedFile> carved, long window) {
        if (carved.isEmpty() || pool.entries().isEmpty()) {
            return pool;
        }
        TreeMap<Long, CarvedFile> byOffset = new TreeMap<>();
        Map<String, CarvedFile> byName = new HashMap<>();
        for (CarvedFile f : carved) {
            byOffset.putIfAbsent(f.offset(), f);
            f.embeddedName().ifPresent(n -> byName.putIfAbsent(n.toLowerCase(Locale.ROOT), f));
        }

        List<StringPoolEntry> linked = new ArrayList<>(pool.entries().size());
        long matches = 0;
        for (StringPoolEntry entry : pool.entries()) {
            Provenance provenance = null;
            if (entry.category() == StringCategory.FILE_PATH) {
                CarvedFile named = byName.get(stem(entry.text()));
                if (named != null) provenance = new Provenance(named, Provenance.Kind.NAME_MATCH, 0);
            }
            if (provenance == null) {
                provenance = nearest(byOffset, entry, window);
            }
            if (provenance != null) matches++;
            linked.add(provenance != null ? entry.withProvenance(provenance) : entry);
        }
        log.debugf("Linked %d of %d strings to carved files", matches, linked.size());
        return pool.withEntries(linked);
    }

    private static Provenance nearest(TreeMap<Long, CarvedFile> byOffset, StringPoolEntry entry, long window) {
        Map.Entry<Long, CarvedFile> before = byOffset.floorEntry(entry.offset());
        Map.Entry<Long, CarvedFile> after = byOffset.higherEntry(entry.offset());
        Provenance best = null;
        if (before != null) {
            CarvedFile f = before.getValue();
            long distance = f.range().distanceTo(entry.range());
            if (distance <= window) {
                Provenance.Kind kind = f.range().contains(entry.offset()) ? Provenance.Kind.CONTAINED : Provenance.Kind.NEARBY;
                best = new Provenance(f, kind, distance);
            }
        }
        if (after != null) {
            CarvedFile f = after.getValue();
            long distance = f.range().distanceTo(entry.range());
            if (distance <= window && (best == null || distance < best.distance())) {
                best = new Provenance(f, Provenance.Kind.NEARBY, distance);
            }
        }
        return best;
    }

    /** File name without directories or extension, lower-cased. */
    static String stem(String path) {
        int slash = Math.max(path.lastIndexOf('\\'), path.lastIndexOf('/'));
        String name = path.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return name.toLowerCase(Locale.ROOT);
    }
}
