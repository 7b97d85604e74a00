package com.libragraph.salvage.core.coverage;

import com.libragraph.salvage.types.CoverageKind;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which claim kinds may not overlap at claim time.
 *
 * <p>Claims of the same kind always conflict. Cross-kind pairs are either exclusive, refused
 * at claim time, or shared, in which case both claims are kept and the overlap is settled by
 * {@link CoverageTracker#reconcile} using {@link CoverageKind#rank()}. Settling shared overlaps
 * at the end makes the final map independent of the order concurrent scanners claim in.
 */
public final class CoveragePolicy {

    private final Map<CoverageKind, Set<CoverageKind>> exclusive;

    private CoveragePolicy(Map<CoverageKind, Set<CoverageKind>> exclusive) {
        this.exclusive = exclusive;
    }

    /**
     * Same-kind exclusive, every cross-kind pair shared.
     */
    public static CoveragePolicy standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<CoverageKind> conflictingWith(CoverageKind kind) {
        return exclusive.get(kind);
    }

    public static final class Builder {
        private final Map<CoverageKind, Set<CoverageKind>> exclusive = new EnumMap<>(CoverageKind.class);

        private Builder() {
            for (CoverageKind kind : CoverageKind.values()) {
                exclusive.put(kind, EnumSet.of(kind));
            }
        }

        public Builder exclusive(CoverageKind a, CoverageKind b) {
            exclusive.get(a).add(b);
            exclusive.get(b).add(a);
            return this;
        }

        public CoveragePolicy build() {
            Map<CoverageKind, Set<CoverageKind>> copy = new EnumMap<>(CoverageKind.class);
            exclusive.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
            return new CoveragePolicy(copy);
        }
    }
}
