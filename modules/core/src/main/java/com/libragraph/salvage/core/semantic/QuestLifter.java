package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.Subrecord;

import java.util.ArrayList;
import java.util.List;

/**
 * QUST. Stages open at INDX and collect the CNAM log entries that follow; objectives open
 * at QOBJ and take the next NNAM as their text.
 */
final class QuestLifter {

    private QuestLifter() {
    }

    static SemanticRecord lift(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        int flags = 0;
        int priority = 0;
        List<SemanticRecord.QuestStage> stages = new ArrayList<>();
        List<SemanticRecord.QuestObjective> objectives = new ArrayList<>();

        Integer stageIndex = null;
        int stageFlags = 0;
        List<String> logEntries = new ArrayList<>();
        Integer objectiveIndex = null;

        for (Subrecord s : raw.subrecords()) {
            switch (s.tag()) {
                case "DATA" -> {
                    if (s.length() >= 2) {
                        flags = s.u8(0);
                        priority = s.u8(1);
                    }
                }
                case "INDX" -> {
                    if (s.length() >= 2) {
                        if (stageIndex != null) {
                            stages.add(new SemanticRecord.QuestStage(stageIndex, stageFlags, List.copyOf(logEntries)));
                        }
                        stageIndex = (int) s.i16(0);
                        stageFlags = 0;
                        logEntries.clear();
                    }
                }
                case "QSDT" -> {
                    if (s.length() >= 1) stageFlags = s.u8(0);
                }
                case "CNAM" -> {
                    if (stageIndex != null) logEntries.add(s.asText());
                }
                case "QOBJ" -> {
                    if (s.length() >= 4) {
                        if (objectiveIndex != null) {
                            objectives.add(new SemanticRecord.QuestObjective(objectiveIndex, null));
                        }
                        objectiveIndex = s.i32(0);
                    }
                }
                case "NNAM" -> {
                    if (objectiveIndex != null) {
                        objectives.add(new SemanticRecord.QuestObjective(objectiveIndex, s.asText()));
                        objectiveIndex = null;
                    }
                }
                default -> {
                }
            }
        }
        if (stageIndex != null) {
            stages.add(new SemanticRecord.QuestStage(stageIndex, stageFlags, List.copyOf(logEntries)));
        }
        if (objectiveIndex != null) {
            objectives.add(new SemanticRecord.QuestObjective(objectiveIndex, null));
        }

        return new SemanticRecord.Quest(identity, Lifts.formId(raw, "SCRI"), flags, priority,
                List.copyOf(stages), List.copyOf(objectives), references);
    }
}
