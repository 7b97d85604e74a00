package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.Subrecord;

import java.util.ArrayList;
import java.util.List;

/**
 * NPC_ and CREA. Race and class are only meaningful on NPC_.
 */
final class ActorLifter {

    private ActorLifter() {
    }

    static SemanticRecord lift(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        boolean npc = "NPC_".equals(raw.tag());
        List<SemanticRecord.FactionRank> factions = new ArrayList<>();
        List<SemanticRecord.ItemCount> inventory = new ArrayList<>();
        for (Subrecord s : raw.subrecords()) {
            if (s.is("SNAM") && s.length() >= 5) {
                factions.add(new SemanticRecord.FactionRank(s.i32(0), s.u8(4)));
            } else if (s.is("CNTO") && s.length() >= 8) {
                inventory.add(new SemanticRecord.ItemCount(s.i32(0), s.i32(4)));
            }
        }
        return new SemanticRecord.Actor(identity,
                npc ? Lifts.formId(raw, "RNAM") : null,
                npc ? Lifts.formId(raw, "CNAM") : null,
                Lifts.formId(raw, "SCRI"),
                List.copyOf(factions), List.copyOf(inventory),
                Lifts.formIds(raw, "PKID"), references);
    }
}
