package com.libragraph.salvage.core.coverage;

import com.libragraph.salvage.core.diagnostic.DiagnosticKind;
import com.libragraph.salvage.core.diagnostic.Diagnostics;
import com.libragraph.salvage.types.CoverageKind;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records which byte ranges of a dump have been attributed to recognized artifacts.
 *
 * <p>Safe for concurrent claims from several scanners. Each claim is an atomic
 * check-then-insert under one lock; no I/O happens while it is held.
 */
public class CoverageTracker {

    private static final Logger log = Logger.getLogger(CoverageTracker.class);

    private static final int LARGEST_GAPS = 10;

    private final long size;
    private final CoveragePolicy policy;
    private final ReentrantLock lock = new ReentrantLock();
    // Per kind, keyed by start; same-kind claims never overlap so each map is disjoint and sorted
    private final Map<CoverageKind, TreeMap<Long, Claim>> claims = new EnumMap<>(CoverageKind.class);

    public CoverageTracker(long size, CoveragePolicy policy) {
        if (size < 0) throw new IllegalArgumentException("size must be >= 0");
        this.size = size;
        this.policy = policy;
        for (CoverageKind kind : CoverageKind.values()) {
            claims.put(kind, new TreeMap<>());
        }
    }

    public CoverageTracker(long size) {
        this(size, CoveragePolicy.standard());
    }

    public long size() {
        return size;
    }

    /**
     * Attributes {@code range} to an artifact of the given kind.
     *
     * @return false, with nothing recorded, if the range conflicts with an existing claim under the policy
     */
    public boolean claim(ByteRange range, CoverageKind kind, String label) {
        if (range.end() > size) {
            throw new IllegalArgumentException("Range " + range + " exceeds buffer size " + size);
        }
        Claim claim = new Claim(range, kind, label);
        lock.lock();
        try {
            for (CoverageKind other : policy.conflictingWith(kind)) {
                if (findOverlap(other, range) != null) {
                    return false;
                }
            }
            claims.get(kind).put(range.start(), claim);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The claim attributed to {@code offset}, preferring the lowest-rank kind when several overlap.
     */
    public Optional<Claim> query(long offset) {
        lock.lock();
        try {
            for (CoverageKind kind : byRank()) {
                Map.Entry<Long, Claim> e = claims.get(kind).floorEntry(offset);
                if (e != null && e.getValue().range().contains(offset)) {
                    return Optional.of(e.getValue());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public List<Claim> claims(CoverageKind kind) {
        lock.lock();
        try {
            return List.copyOf(claims.get(kind).values());
        } finally {
            lock.unlock();
        }
    }

    public int claimCount() {
        lock.lock();
        try {
            return claims.values().stream().mapToInt(Map::size).sum();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unclaimed ranges in offset order. Each call to {@code iterator()} takes a fresh snapshot,
     * so the sequence is restartable and reflects claims made since the previous pass.
     */
    public Iterable<ByteRange> gaps() {
        return () -> new GapIterator(snapshot(), size);
    }

    /**
     * Settles cross-kind overlaps by rank and returns the terminal, overlap-free map.
     * Every claim that loses bytes is reported as {@link DiagnosticKind#COVERAGE_TRIMMED}.
     */
    public ReconciledCoverage reconcile(Diagnostics diagnostics) {
        List<Claim> all = snapshot();
        TreeSet<Long> points = new TreeSet<>();
        for (Claim c : all) {
            points.add(c.start());
            points.add(c.end());
        }

        List<Claim> out = new ArrayList<>();
        Map<Claim, Long> kept = new IdentityHashMap<>();
        Map<CoverageKind, Claim> active = new EnumMap<>(CoverageKind.class);
        List<CoverageKind> ranked = byRank();
        int next = 0;
        Claim lastOwner = null;

        Long p = points.isEmpty() ? null : points.first();
        while (p != null) {
            long at = p;
            active.values().removeIf(c -> c.end() <= at);
            while (next < all.size() && all.get(next).start() == at) {
                Claim c = all.get(next++);
                active.put(c.kind(), c);
            }
            Long q = points.higher(at);
            if (q == null) break;

            Claim owner = null;
            for (CoverageKind kind : ranked) {
                owner = active.get(kind);
                if (owner != null) break;
            }
            if (owner != null) {
                kept.merge(owner, q - at, Long::sum);
                Claim tail = out.isEmpty() ? null : out.get(out.size() - 1);
                if (owner == lastOwner && tail != null && tail.end() == at) {
                    out.set(out.size() - 1, owner.slice(tail.start(), q));
                } else {
                    out.add(owner.slice(at, q));
                }
            }
            lastOwner = owner;
            p = q;
        }

        long trimmed = 0;
        for (Claim c : all) {
            long keptBytes = kept.getOrDefault(c, 0L);
            if (keptBytes < c.range().length()) {
                trimmed++;
                diagnostics.record(DiagnosticKind.COVERAGE_TRIMMED, c.start(),
                        String.format("%s %s kept %d of %d bytes", c.kind().label(), c.label(),
                                keptBytes, c.range().length()));
            }
        }

        CoverageSummary summary = summarize(out);
        log.debugf("Reconciled %d claims into %d spans, %d trimmed, %.2f%% covered",
                all.size(), out.size(), trimmed, summary.claimedPercent());
        return new ReconciledCoverage(List.copyOf(out), summary, trimmed);
    }

    private CoverageSummary summarize(List<Claim> disjoint) {
        Map<CoverageKind, Long> byKind = new EnumMap<>(CoverageKind.class);
        for (CoverageKind kind : CoverageKind.values()) {
            byKind.put(kind, 0L);
        }
        long claimed = 0;
        for (Claim c : disjoint) {
            claimed += c.range().length();
            byKind.merge(c.kind(), c.range().length(), Long::sum);
        }

        long gapCount = 0;
        long gapBytes = 0;
        List<ByteRange> gaps = new ArrayList<>();
        Iterator<ByteRange> it = new GapIterator(disjoint, size);
        while (it.hasNext()) {
            ByteRange gap = it.next();
            gapCount++;
            gapBytes += gap.length();
            gaps.add(gap);
        }
        gaps.sort(Comparator.comparingLong(ByteRange::length).reversed().thenComparing(ByteRange::start));
        List<ByteRange> largest = List.copyOf(gaps.subList(0, Math.min(LARGEST_GAPS, gaps.size())));

        return new CoverageSummary(size, claimed, Map.copyOf(byKind), gapCount, gapBytes, largest);
    }

    private Claim findOverlap(CoverageKind kind, ByteRange range) {
        Map.Entry<Long, Claim> e = claims.get(kind).lowerEntry(range.end());
        if (e != null && e.getValue().end() > range.start()) {
            return e.getValue();
        }
        return null;
    }

    private List<Claim> snapshot() {
        List<Claim> all = new ArrayList<>();
        lock.lock();
        try {
            for (TreeMap<Long, Claim> byStart : claims.values()) {
                all.addAll(byStart.values());
            }
        } finally {
            lock.unlock();
        }
        all.sort(Comparator.comparing(Claim::range).thenComparingInt(c -> c.kind().rank()));
        return all;
    }

    private static List<CoverageKind> byRank() {
        List<CoverageKind> kinds = new ArrayList<>(List.of(CoverageKind.values()));
        kinds.sort(Comparator.comparingInt(CoverageKind::rank));
        return kinds;
    }

    /**
     * Walks claims sorted by start and yields the holes between their union.
     */
    private static final class GapIterator implements Iterator<ByteRange> {
        private final List<Claim> sorted;
        private final long size;
        private int index;
        private long cursor;
        private ByteRange pending;

        GapIterator(List<Claim> sorted, long size) {
            this.sorted = sorted;
            this.size = size;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public ByteRange next() {
            if (!hasNext()) throw new NoSuchElementException();
            ByteRange gap = pending;
            pending = null;
            return gap;
        }

        private ByteRange advance() {
            while (index < sorted.size()) {
                Claim c = sorted.get(index++);
                if (c.start() > cursor) {
                    ByteRange gap = new ByteRange(cursor, c.start());
                    cursor = c.end();
                    return gap;
                }
                cursor = Math.max(cursor, c.end());
            }
            if (cursor < size) {
                ByteRange gap = new ByteRange(cursor, size);
                cursor = size;
                return gap;
            }
            return null;
        }
    }
}
