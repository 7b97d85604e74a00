package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.RecordTypes;
import com.libragraph.salvage.core.esm.Subrecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Reads outgoing FormID references straight from subrecords, without lifting. Works for
 * every record, lifted or not.
 */
public final class References {

    // Subrecords that are FormIDs only in some record types
    private static final Map<String, Set<String>> TYPE_SPECIFIC = Map.of(
            "INFO", Set.of("ANAM", "TCLT", "TCLF", "TPIC"),
            "NPC_", Set.of("CNAM", "PKID", "INAM", "VTCK"),
            "CREA", Set.of("PKID", "INAM", "VTCK"),
            "REFR", Set.of("XOWN"),
            "ACHR", Set.of("XOWN"),
            "ACRE", Set.of("XOWN"),
            "QUST", Set.of("QSTA"));

    // Carry a FormID followed by a count or rank
    private static final Set<String> PAIRED = Set.of("CNTO", "SNAM", "QSTA");

    private References() {
    }

    public static List<FormIdRef> of(RawRecord raw) {
        Set<String> extra = TYPE_SPECIFIC.getOrDefault(raw.tag(), Set.of());
        List<FormIdRef> refs = new ArrayList<>();
        for (Subrecord s : raw.subrecords()) {
            String tag = s.tag();
            if (!RecordTypes.REFERENCE_SUBRECORDS.contains(tag) && !extra.contains(tag)) continue;
            if (s.length() != 4 && !(PAIRED.contains(tag) && s.length() == 8)) continue;
            OptionalInt id = s.formId();
            if (id.isPresent() && id.getAsInt() != 0) {
                refs.add(new FormIdRef(tag, id.getAsInt()));
            }
        }
        return List.copyOf(refs);
    }
}
