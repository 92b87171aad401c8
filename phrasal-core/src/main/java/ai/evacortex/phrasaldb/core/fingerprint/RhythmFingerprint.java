/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.fingerprint;

import ai.evacortex.phrasaldb.core.grid.MeasureGrid;

import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Set of sixteenth-note cells of one measure that carry at least one onset.
 *
 * <p>Backed by a 16-bit mask, so equality and hashing ignore insertion order and
 * the value can key corpus-level maps directly. The natural order is the ranking
 * tie-break: fewer cells first, then the sorted cell lists lexicographically.</p>
 */
public final class RhythmFingerprint implements Comparable<RhythmFingerprint> {

    private static final int CELLS = MeasureGrid.SUBDIVISIONS_PER_MEASURE;
    private static final RhythmFingerprint EMPTY = new RhythmFingerprint(0);

    private final int mask;

    private RhythmFingerprint(int mask) {
        this.mask = mask;
    }

    public static RhythmFingerprint empty() {
        return EMPTY;
    }

    public static RhythmFingerprint of(int... positions) {
        int mask = 0;
        for (int position : positions) {
            mask |= bit(position);
        }
        return new RhythmFingerprint(mask);
    }

    public static RhythmFingerprint of(Collection<Integer> positions) {
        return of(positions.stream().mapToInt(Integer::intValue).toArray());
    }

    public static RhythmFingerprint fromMask(int mask) {
        if ((mask & ~((1 << CELLS) - 1)) != 0) {
            throw new IllegalArgumentException("Mask has bits outside " + CELLS + " cells: " + Integer.toBinaryString(mask));
        }
        return new RhythmFingerprint(mask);
    }

    public RhythmFingerprint with(int position) {
        return new RhythmFingerprint(mask | bit(position));
    }

    public boolean contains(int position) {
        return position >= 0 && position < CELLS && (mask & (1 << position)) != 0;
    }

    public int size() {
        return Integer.bitCount(mask);
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public int mask() {
        return mask;
    }

    /** Cells in ascending order. */
    public int[] positions() {
        return IntStream.range(0, CELLS).filter(this::contains).toArray();
    }

    /** Sixteen characters, {@code x} for an onset cell and {@code .} otherwise. */
    public String toGrid() {
        StringBuilder sb = new StringBuilder(CELLS);
        for (int i = 0; i < CELLS; i++) {
            sb.append(contains(i) ? 'x' : '.');
        }
        return sb.toString();
    }

    @Override
    public int compareTo(RhythmFingerprint other) {
        int bySize = Integer.compare(size(), other.size());
        if (bySize != 0) return bySize;
        return Arrays.compare(positions(), other.positions());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RhythmFingerprint other && other.mask == mask;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(mask);
    }

    @Override
    public String toString() {
        return Arrays.stream(positions()).mapToObj(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }

    private static int bit(int position) {
        if (position < 0 || position >= CELLS) {
            throw new IllegalArgumentException("Subdivision " + position + " outside [0, " + CELLS + ")");
        }
        return 1 << position;
    }
}
