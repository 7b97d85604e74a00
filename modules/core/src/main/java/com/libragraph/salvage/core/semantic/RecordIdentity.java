package com.libragraph.salvage.core.semantic;

import com.libragraph.salvage.core.esm.FormIds;

import java.util.Optional;

/**
 * Identity shared by every semantic record.
 *
 * @param editorId internal identifier from EDID, or null
 * @param fullName display name from FULL, or null
 */
public record RecordIdentity(int formId, String tag, long offset, String editorId, String fullName) {

    /** Display name first, then editor ID. */
    public Optional<String> bestName() {
        if (fullName != null && !fullName.isEmpty()) return Optional.of(fullName);
        if (editorId != null && !editorId.isEmpty()) return Optional.of(editorId);
        return Optional.empty();
    }

    public String formIdHex() {
        return FormIds.hex(formId);
    }
}
