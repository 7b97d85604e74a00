package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.Subrecord;

import java.util.List;

/**
 * Placed references. DATA holds position then rotation as six floats.
 */
final class PlacementLifter {

    private PlacementLifter() {
    }

    static SemanticRecord lift(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        SemanticRecord.Position position = raw.first("DATA")
                .filter(s -> s.length() >= 24)
                .map(PlacementLifter::position)
                .orElse(null);
        return new SemanticRecord.Placement(identity, Lifts.formId(raw, "NAME"), position,
                Lifts.f32(raw, "XSCL", 0), Lifts.formId(raw, "XOWN"), references);
    }

    private static SemanticRecord.Position position(Subrecord s) {
        return new SemanticRecord.Position(s.f32(0), s.f32(4), s.f32(8), s.f32(12), s.f32(16), s.f32(20));
    }
}
