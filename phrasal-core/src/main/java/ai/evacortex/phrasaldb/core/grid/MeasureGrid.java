/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.grid;

/**
 * Fixed 4/4 sixteenth-note grid derived from a tick resolution.
 *
 * <p>All arithmetic is integer (floor) division. When {@code ppqn} is not a multiple
 * of four the subdivision length is truncated, which is an accepted approximation:
 * late onsets of such a measure may compute a subdivision past the last cell, and
 * those are reported in the last cell ({@value #SUBDIVISIONS_PER_MEASURE} - 1).
 * Resolutions below four ticks per quarter use a one-tick subdivision.</p>
 *
 * @param ppqn ticks per quarter note, strictly positive
 */
public record MeasureGrid(int ppqn) {

    public static final int BEATS_PER_MEASURE = 4;
    public static final int SUBDIVISIONS_PER_BEAT = 4;
    public static final int SUBDIVISIONS_PER_MEASURE = BEATS_PER_MEASURE * SUBDIVISIONS_PER_BEAT;

    public MeasureGrid {
        if (ppqn <= 0) {
            throw new IllegalArgumentException("ppqn must be positive: " + ppqn);
        }
    }

    public long measureLengthTicks() {
        return (long) BEATS_PER_MEASURE * ppqn;
    }

    public long subdivisionTicks() {
        return Math.max(1, ppqn / SUBDIVISIONS_PER_BEAT);
    }

    public int measureIndexOf(long tick) {
        return Math.toIntExact(tick / measureLengthTicks());
    }

    public long measureStart(int measureIndex) {
        return measureIndex * measureLengthTicks();
    }

    public long measureEnd(int measureIndex) {
        return (measureIndex + 1L) * measureLengthTicks();
    }

    /** Sixteenth-note cell of {@code tick} inside its measure, in {@code [0, 16)}. */
    public int subdivisionOf(long tick) {
        long offset = tick - measureStart(measureIndexOf(tick));
        long cell = offset / subdivisionTicks();
        return (int) Math.min(cell, SUBDIVISIONS_PER_MEASURE - 1);
    }

    /** Measures needed to hold an onset at {@code lastOnsetTick}; always at least one. */
    public int measureCount(long lastOnsetTick) {
        return measureIndexOf(lastOnsetTick) + 1;
    }
}
