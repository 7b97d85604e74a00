package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.Subrecord;

import java.util.ArrayList;
import java.util.List;

/**
 * INFO responses and DIAL topics.
 */
final class DialogueLifter {

    private DialogueLifter() {
    }

    /**
     * Each TRDT opens a response and the following NAM1 carries its text. A NAM1 with no
     * TRDT before it still becomes a response with neutral emotion.
     */
    static SemanticRecord liftInfo(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        List<SemanticRecord.Response> responses = new ArrayList<>();
        int number = 0;
        int emotionType = 0;
        int emotionValue = 0;
        for (Subrecord s : raw.subrecords()) {
            if (s.is("TRDT") && s.length() >= 20) {
                emotionType = s.i32(0);
                emotionValue = s.i32(4);
                number = s.u8(12);
            } else if (s.is("NAM1")) {
                responses.add(new SemanticRecord.Response(number, s.asText(), emotionType, emotionValue));
                number = 0;
                emotionType = 0;
                emotionValue = 0;
            }
        }
        return new SemanticRecord.DialogueInfo(identity,
                Lifts.formId(raw, "QSTI"), Lifts.formId(raw, "TPIC"), Lifts.formId(raw, "PNAM"),
                Lifts.formId(raw, "ANAM"), List.copyOf(responses), Lifts.formIds(raw, "TCLT"), references);
    }

    static SemanticRecord liftTopic(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        int topicType = raw.first("DATA").filter(s -> s.length() >= 1).map(s -> s.u8(0)).orElse(0);
        return new SemanticRecord.DialogTopic(identity, Lifts.formIds(raw, "QSTI"), topicType, references);
    }
}
