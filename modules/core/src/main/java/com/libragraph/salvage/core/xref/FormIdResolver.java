package com.libragraph.salvage.core.xref;

import com.libragraph.salvage.core.esm.FormIds;
import com.libragraph.salvage.core.esm.RawRecord;
import com.libragraph.salvage.core.semantic.FormIdRef;
import com.libragraph.salvage.core.semantic.References;
import com.libragraph.salvage.core.semantic.SemanticRecord;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Answers FormID questions against one image.
 *
 * <p>Name lookup and existence are separate questions: {@link #resolve} returns
 * {@link #UNRESOLVED} for a record that is present but has no derivable name, while
 * {@link #exists} only asks whether any record with that FormID was found.
 */
public class FormIdResolver {

    public static final String UNRESOLVED = "unresolved";

    private final FormIdIndex<RawRecord> raw;
    private final FormIdIndex<SemanticRecord> semantic;

    public FormIdResolver(FormIdIndex<RawRecord> raw, FormIdIndex<SemanticRecord> semantic) {
        this.raw = raw;
        this.semantic = semantic;
    }

    /**
     * Best name for {@code formId}: display name, then editor ID, else {@link #UNRESOLVED}.
     */
    public String resolve(int formId) {
        return bestName(formId).orElse(UNRESOLVED);
    }

    public boolean exists(int formId) {
        return raw.contains(formId) || semantic.contains(formId);
    }

    public Resolution lookup(int formId) {
        Optional<String> name = bestName(formId);
        if (name.isPresent()) {
            return new Resolution(formId, ResolutionStatus.RESOLVED, tagOf(formId), name.get());
        }
        if (exists(formId)) {
            return new Resolution(formId, ResolutionStatus.UNRESOLVED, tagOf(formId), null);
        }
        return new Resolution(formId, ResolutionStatus.MISSING, null, null);
    }

    public Optional<String> editorId(int formId) {
        return semantic.get(formId).map(r -> r.identity().editorId());
    }

    public Optional<String> displayName(int formId) {
        return semantic.get(formId).map(r -> r.identity().fullName());
    }

    public Optional<SemanticRecord> record(int formId) {
        return semantic.get(formId);
    }

    /**
     * Name for a placed reference, falling back to the base object it places.
     */
    public String resolveThroughBase(int formId) {
        Optional<String> own = bestName(formId);
        if (own.isPresent()) return own.get();
        return baseOf(formId).map(this::resolve).orElse(UNRESOLVED);
    }

    public Optional<Integer> baseOf(int formId) {
        return semantic.get(formId)
                .filter(r -> r instanceof SemanticRecord.Placement)
                .map(r -> ((SemanticRecord.Placement) r).base());
    }

    /**
     * Label in the form {@code Name - EditorId (0x00012345)}, dropping whichever parts are absent.
     */
    public String describe(int formId) {
        String hex = FormIds.hex(formId);
        Optional<SemanticRecord> record = semantic.get(formId);
        if (record.isEmpty()) {
            return exists(formId) ? tagOf(formId) + " " + hex : hex + " [missing]";
        }
        String full = record.get().identity().fullName();
        String edid = record.get().identity().editorId();
        StringBuilder sb = new StringBuilder();
        if (full != null && !full.isEmpty()) sb.append(full);
        if (edid != null && !edid.isEmpty()) {
            if (sb.length() > 0) sb.append(" - ");
            sb.append(edid);
        }
        if (sb.length() == 0) sb.append(record.get().tag());
        return sb.append(" (").append(hex).append(')').toString();
    }

    /**
     * Outgoing references of {@code formId}, each looked up as the sequence is walked.
     * Unlifted records contribute references read from their raw subrecords, marked partial.
     * Each call to {@code iterator()} starts over.
     */
    public Iterable<ResolvedReference> references(int formId) {
        return () -> {
            Optional<SemanticRecord> lifted = semantic.get(formId).filter(r -> !(r instanceof SemanticRecord.Generic));
            List<FormIdRef> refs;
            boolean partial;
            if (lifted.isPresent()) {
                refs = lifted.get().references();
                partial = false;
            } else {
                refs = raw.get(formId).map(References::of).orElse(List.of());
                partial = true;
            }
            return new ResolvingIterator(refs.iterator(), partial);
        };
    }

    private Optional<String> bestName(int formId) {
        return semantic.get(formId).flatMap(SemanticRecord::bestName);
    }

    private String tagOf(int formId) {
        return semantic.get(formId).map(SemanticRecord::tag)
                .or(() -> raw.get(formId).map(RawRecord::tag))
                .orElse(null);
    }

    private final class ResolvingIterator implements Iterator<ResolvedReference> {
        private final Iterator<FormIdRef> refs;
        private final boolean partial;

        ResolvingIterator(Iterator<FormIdRef> refs, boolean partial) {
            this.refs = refs;
            this.partial = partial;
        }

        @Override
        public boolean hasNext() {
            return refs.hasNext();
        }

        @Override
        public ResolvedReference next() {
            if (!refs.hasNext()) throw new NoSuchElementException();
            FormIdRef ref = refs.next();
            return new ResolvedReference(ref, lookup(ref.formId()), partial);
        }
    }
}
