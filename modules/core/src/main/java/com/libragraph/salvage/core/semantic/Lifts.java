package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.Subrecord;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Small field readers shared by the lifters.
 */
final class Lifts {

    private Lifts() {
    }

    static Integer formId(RawRecord raw, String tag) {
        return raw.first(tag).map(Lifts::formId).orElse(null);
    }

    static Integer formId(Subrecord s) {
        OptionalInt id = s.formId();
        return id.isPresent() && id.getAsInt() != 0 ? id.getAsInt() : null;
    }

    static List<Integer> formIds(RawRecord raw, String tag) {
        List<Integer> out = new ArrayList<>();
        for (Subrecord s : raw.all(tag)) {
            Integer id = formId(s);
            if (id != null) out.add(id);
        }
        return List.copyOf(out);
    }

    static String text(RawRecord raw, String tag) {
        return raw.first(tag).map(Subrecord::asText).filter(t -> !t.isEmpty()).orElse(null);
    }

    static Integer i32(RawRecord raw, String tag, int index) {
        return raw.first(tag).filter(s -> s.length() >= index + 4).map(s -> s.i32(index)).orElse(null);
    }

    static Float f32(RawRecord raw, String tag, int index) {
        return raw.first(tag).filter(s -> s.length() >= index + 4).map(s -> s.f32(index)).orElse(null);
    }
}
