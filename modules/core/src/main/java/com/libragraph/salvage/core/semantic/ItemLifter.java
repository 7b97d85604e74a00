package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;

import java.util.List;
import java.util.Map;

/**
 * Inventory items. Value and weight sit at type-dependent offsets of DATA.
 */
final class ItemLifter {

    private record Layout(String valueTag, int valueOffset, String weightTag, int weightOffset, String textTag) {
    }

    private static final Map<String, Layout> LAYOUTS = Map.of(
            "WEAP", new Layout("DATA", 0, "DATA", 8, null),
            "ARMO", new Layout("DATA", 0, "DATA", 8, null),
            "MISC", new Layout("DATA", 0, "DATA", 4, null),
            "KEYM", new Layout("DATA", 0, "DATA", 4, null),
            "BOOK", new Layout("DATA", 2, "DATA", 6, "DESC"),
            "AMMO", new Layout("DATA", 8, null, 0, null),
            "ALCH", new Layout("ENIT", 0, "DATA", 0, null),
            "NOTE", new Layout(null, 0, null, 0, "TNAM"));

    private ItemLifter() {
    }

    static List<String> tags() {
        return List.copyOf(LAYOUTS.keySet());
    }

    static SemanticRecord lift(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        Layout layout = LAYOUTS.get(raw.tag());
        Integer value = layout.valueTag() != null ? Lifts.i32(raw, layout.valueTag(), layout.valueOffset()) : null;
        Float weight = layout.weightTag() != null ? Lifts.f32(raw, layout.weightTag(), layout.weightOffset()) : null;
        String text = layout.textTag() != null ? Lifts.text(raw, layout.textTag()) : null;
        return new SemanticRecord.Item(identity,
                Lifts.text(raw, "MODL"), Lifts.text(raw, "ICON"), Lifts.formId(raw, "SCRI"),
                value, weight, text, references);
    }
}
