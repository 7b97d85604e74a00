package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.diagnostic.DiagnosticKind;
import com.libragraph.salvage.core.diagnostic.Diagnostics;
import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.RecordTypes;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps record tags to lifters. Tags without a lifter come back as {@link SemanticRecord.Generic}.
 *
 * <p>Registration is checked when the registry is built: a tag may be registered once and
 * must be a known record type.
 */
public final class LiftingRegistry {

    private static final Logger log = Logger.getLogger(LiftingRegistry.class);

    static final List<String> NAMED_TYPES = List.of(
            "CELL", "WRLD", "FACT", "RACE", "CLAS", "GLOB", "GMST",
            "CONT", "DOOR", "LIGH", "STAT", "TERM", "FURN",
            "MESG", "PERK", "SPEL", "ENCH", "MGEF", "PACK", "SOUN", "MUSC");

    private final Map<String, RecordLifter> lifters;

    private LiftingRegistry(Map<String, RecordLifter> lifters) {
        this.lifters = Map.copyOf(lifters);
    }

    public static LiftingRegistry standard() {
        return builder()
                .register(QuestLifter::lift, "QUST")
                .register(ActorLifter::lift, "NPC_", "CREA")
                .register(ItemLifter::lift, ItemLifter.tags().toArray(String[]::new))
                .register(DialogueLifter::liftInfo, "INFO")
                .register(DialogueLifter::liftTopic, "DIAL")
                .register(ScriptLifter::lift, "SCPT")
                .register(PlacementLifter::lift, "REFR", "ACHR", "ACRE", "PGRE", "PMIS")
                .register(LiftingRegistry::named, NAMED_TYPES.toArray(String[]::new))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean handles(String tag) {
        return lifters.containsKey(tag);
    }

    public Set<String> tags() {
        return lifters.keySet();
    }

    /**
     * Lifts one record. A lifter that throws leaves the record generic and is reported as
     * {@link DiagnosticKind#LIFT_FAILED}.
     */
    public SemanticRecord lift(RawRecord raw, Diagnostics diagnostics) {
        List<FormIdRef> references = References.of(raw);
        RecordLifter lifter = lifters.get(raw.tag());
        if (lifter == null) {
            return generic(raw, references);
        }
        RecordIdentity identity = new RecordIdentity(raw.formId(), raw.tag(), raw.offset(),
                raw.editorId().orElse(null), Lifts.text(raw, "FULL"));
        try {
            return lifter.lift(raw, identity, references);
        } catch (RuntimeException e) {
            diagnostics.record(DiagnosticKind.LIFT_FAILED, raw.offset(), raw.label() + ": " + e);
            return generic(raw, references);
        }
    }

    private static SemanticRecord generic(RawRecord raw, List<FormIdRef> references) {
        return new SemanticRecord.Generic(
                new RecordIdentity(raw.formId(), raw.tag(), raw.offset(), null, null), references);
    }

    private static SemanticRecord named(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        return new SemanticRecord.Named(identity, Lifts.text(raw, "DESC"), Lifts.text(raw, "MODL"), references);
    }

    public static final class Builder {
        private final Map<String, RecordLifter> lifters = new TreeMap<>();

        private Builder() {
        }

        public Builder register(RecordLifter lifter, String... tags) {
            for (String tag : tags) {
                if (!RecordTypes.isKnown(tag)) {
                    throw new IllegalStateException("Lifter registered for unknown record type " + tag);
                }
                if (lifters.putIfAbsent(tag, lifter) != null) {
                    throw new IllegalStateException("Lifter already registered for " + tag);
                }
            }
            return this;
        }

        public LiftingRegistry build() {
            log.debugf("Lifting registry: %d record types %s", lifters.size(), lifters.keySet());
            return new LiftingRegistry(lifters);
        }
    }
}
