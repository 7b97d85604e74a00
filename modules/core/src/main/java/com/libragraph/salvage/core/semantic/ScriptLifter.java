package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.esm.Subrecord;

import java.util.List;

final class ScriptLifter {

    private ScriptLifter() {
    }

    static SemanticRecord lift(RawRecord raw, RecordIdentity identity, List<FormIdRef> references) {
        List<String> variables = raw.all("SCVR").stream()
                .map(Subrecord::asText)
                .filter(v -> !v.isEmpty())
                .toList();
        return new SemanticRecord.Script(identity, Lifts.text(raw, "SCTX"),
                Lifts.formIds(raw, "SCRO"), variables, references);
    }
}
