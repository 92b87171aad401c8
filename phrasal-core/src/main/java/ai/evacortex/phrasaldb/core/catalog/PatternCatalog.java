/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.catalog;

import ai.evacortex.phrasaldb.core.analysis.PieceAnalysis;
import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;
import ai.evacortex.phrasaldb.core.util.AutoLock;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Corpus-wide counters keyed by rhythm fingerprint.
 *
 * <p>Occurrences count measures, support counts pieces: a fingerprint repeated
 * within one piece raises its occurrences each time but adds the piece to its
 * support once. Counters only grow. Merging catalogs adds occurrences and unions
 * support sets, so the final content does not depend on the order pieces or
 * partial catalogs are merged in. All operations are thread-safe.</p>
 */
public class PatternCatalog {

    /**
     * Reporting order: more supporting pieces first, then more occurrences, then
     * fewer cells, then sorted cell lists lexicographically.
     */
    public static final Comparator<CatalogEntry> RANKING =
            Comparator.comparingInt(CatalogEntry::supportCount).reversed()
                    .thenComparing(Comparator.comparingLong(CatalogEntry::occurrences).reversed())
                    .thenComparing(CatalogEntry::fingerprint);

    private final Map<RhythmFingerprint, Counter> counters = new HashMap<>();
    private final Set<String> pieces = new HashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private static final class Counter {
        long occurrences;
        final Set<String> support = new HashSet<>();
    }

    /** Partial catalog holding the contribution of a single piece. */
    public static PatternCatalog ofPiece(String pieceId, Collection<RhythmFingerprint> measures) {
        PatternCatalog catalog = new PatternCatalog();
        catalog.contribute(pieceId, measures);
        return catalog;
    }

    /** Merges partial catalogs into a new one; an empty collection gives an empty catalog. */
    public static PatternCatalog mergeAll(Collection<PatternCatalog> partials) {
        PatternCatalog merged = new PatternCatalog();
        partials.forEach(merged::merge);
        return merged;
    }

    public void contribute(String pieceId, PieceAnalysis analysis) {
        contribute(pieceId, analysis.rhythmFingerprints());
    }

    public void contribute(String pieceId, Collection<RhythmFingerprint> measures) {
        Objects.requireNonNull(pieceId, "pieceId");
        AutoLock.writing(lock, () -> {
            pieces.add(pieceId);
            for (RhythmFingerprint fingerprint : measures) {
                Counter counter = counters.computeIfAbsent(fingerprint, f -> new Counter());
                counter.occurrences++;
                counter.support.add(pieceId);
            }
        });
    }

    /** Adds every counter of {@code other} into this catalog. */
    public void merge(PatternCatalog other) {
        if (other == this) {
            throw new IllegalArgumentException("Cannot merge a catalog into itself");
        }
        Map<RhythmFingerprint, CatalogEntry> incoming = other.snapshot();
        Set<String> incomingPieces = other.pieceIds();
        try (AutoLock ignored = AutoLock.write(lock)) {
            pieces.addAll(incomingPieces);
            for (CatalogEntry entry : incoming.values()) {
                Counter counter = counters.computeIfAbsent(entry.fingerprint(), f -> new Counter());
                counter.occurrences += entry.occurrences();
                counter.support.addAll(entry.support());
            }
        }
    }

    public Optional<CatalogEntry> entry(RhythmFingerprint fingerprint) {
        return AutoLock.reading(lock,
                () -> Optional.ofNullable(counters.get(fingerprint)).map(c -> toEntry(fingerprint, c)));
    }

    public Map<RhythmFingerprint, CatalogEntry> snapshot() {
        try (AutoLock ignored = AutoLock.read(lock)) {
            Map<RhythmFingerprint, CatalogEntry> copy = new HashMap<>();
            counters.forEach((fingerprint, counter) -> copy.put(fingerprint, toEntry(fingerprint, counter)));
            return copy;
        }
    }

    /** All entries in {@link #RANKING} order. */
    public List<CatalogEntry> ranked() {
        List<CatalogEntry> entries = new ArrayList<>(snapshot().values());
        entries.sort(RANKING);
        return entries;
    }

    public List<CatalogEntry> top(int limit) {
        List<CatalogEntry> ranked = ranked();
        return ranked.subList(0, Math.min(Math.max(limit, 0), ranked.size()));
    }

    /** Distinct fingerprints. */
    public int size() {
        return AutoLock.reading(lock, counters::size);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Pieces that contributed, including pieces without any measure. */
    public Set<String> pieceIds() {
        return AutoLock.reading(lock, () -> new TreeSet<>(pieces));
    }

    public long totalOccurrences() {
        return AutoLock.reading(lock, () -> counters.values().stream().mapToLong(c -> c.occurrences).sum());
    }

    private static CatalogEntry toEntry(RhythmFingerprint fingerprint, Counter counter) {
        return new CatalogEntry(fingerprint, counter.occurrences, new TreeSet<>(counter.support));
    }
}
