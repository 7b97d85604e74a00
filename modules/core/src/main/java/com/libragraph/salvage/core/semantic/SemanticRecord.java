package com.libragraph.salvage.core.semantic;

import java.util.List;
import java.util.Optional;

/**
 * A record lifted into a typed entity.
 *
 * <p>Optional FormID fields are null when the record does not carry them.
 */
public sealed interface SemanticRecord {

    RecordIdentity identity();

    List<FormIdRef> references();

    default int formId() {
        return identity().formId();
    }

    default String tag() {
        return identity().tag();
    }

    default Optional<String> bestName() {
        return identity().bestName();
    }

    /** A record kept without lifting. Names are not read, so it resolves as unresolved. */
    record Generic(RecordIdentity identity, List<FormIdRef> references) implements SemanticRecord {
    }

    /** A named entity with no further typed fields of interest (cells, factions, statics, ...). */
    record Named(RecordIdentity identity, String description, String modelPath,
                 List<FormIdRef> references) implements SemanticRecord {
    }

    record Quest(RecordIdentity identity, Integer script, int flags, int priority,
                 List<QuestStage> stages, List<QuestObjective> objectives,
                 List<FormIdRef> references) implements SemanticRecord {
    }

    record Actor(RecordIdentity identity, Integer race, Integer actorClass, Integer script,
                 List<FactionRank> factions, List<ItemCount> inventory, List<Integer> packages,
                 List<FormIdRef> references) implements SemanticRecord {
    }

    record Item(RecordIdentity identity, String modelPath, String iconPath, Integer script,
                Integer value, Float weight, String text,
                List<FormIdRef> references) implements SemanticRecord {
    }

    record DialogueInfo(RecordIdentity identity, Integer quest, Integer topic, Integer previousInfo,
                        Integer speaker, List<Response> responses, List<Integer> linkedTopics,
                        List<FormIdRef> references) implements SemanticRecord {
    }

    record DialogTopic(RecordIdentity identity, List<Integer> quests, int topicType,
                       List<FormIdRef> references) implements SemanticRecord {
    }

    record Script(RecordIdentity identity, String source, List<Integer> referencedObjects,
                  List<String> variables, List<FormIdRef> references) implements SemanticRecord {
    }

    /** A placed instance of a base object (REFR, ACHR, ACRE, ...). */
    record Placement(RecordIdentity identity, Integer base, Position position, Float scale, Integer owner,
                     List<FormIdRef> references) implements SemanticRecord {
    }

    record QuestStage(int index, int flags, List<String> logEntries) {
    }

    record QuestObjective(int index, String text) {
    }

    record FactionRank(int faction, int rank) {
    }

    record ItemCount(int item, int count) {
    }

    record Response(int number, String text, int emotionType, int emotionValue) {
    }

    record Position(float x, float y, float z, float rotX, float rotY, float rotZ) {
    }
}
