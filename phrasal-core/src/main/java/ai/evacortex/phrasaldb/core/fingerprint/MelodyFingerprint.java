/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.fingerprint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered onsets of one measure, sorted by cell and then pitch. Two measures are
 * melodically equal when their sorted sequences are equal element by element.
 */
public final class MelodyFingerprint implements Comparable<MelodyFingerprint> {

    private static final MelodyFingerprint EMPTY = new MelodyFingerprint(List.of());

    private final List<Onset> onsets;

    private MelodyFingerprint(List<Onset> sorted) {
        this.onsets = sorted;
    }

    public static MelodyFingerprint empty() {
        return EMPTY;
    }

    public static MelodyFingerprint of(Collection<Onset> onsets) {
        List<Onset> sorted = new ArrayList<>(onsets);
        sorted.sort(null);
        return new MelodyFingerprint(List.copyOf(sorted));
    }

    public List<Onset> onsets() {
        return onsets;
    }

    public int size() {
        return onsets.size();
    }

    public boolean isEmpty() {
        return onsets.isEmpty();
    }

    /** Cells with onsets, which is the rhythm this melody implies. */
    public RhythmFingerprint rhythm() {
        RhythmFingerprint rhythm = RhythmFingerprint.empty();
        for (Onset onset : onsets) {
            rhythm = rhythm.with(onset.position());
        }
        return rhythm;
    }

    @Override
    public int compareTo(MelodyFingerprint other) {
        Iterator<Onset> a = onsets.iterator();
        Iterator<Onset> b = other.onsets.iterator();
        while (a.hasNext() && b.hasNext()) {
            int c = a.next().compareTo(b.next());
            if (c != 0) return c;
        }
        return Boolean.compare(a.hasNext(), b.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MelodyFingerprint other && other.onsets.equals(onsets);
    }

    @Override
    public int hashCode() {
        return onsets.hashCode();
    }

    @Override
    public String toString() {
        return onsets.toString();
    }
}
