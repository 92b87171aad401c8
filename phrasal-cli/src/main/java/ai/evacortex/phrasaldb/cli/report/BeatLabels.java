/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.report;

import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;
import ai.evacortex.phrasaldb.core.grid.MeasureGrid;

/**
 * Counting syllables for sixteenth cells: {@code Beat 1, Beat 1+, Beat 1&, Beat 1a}.
 */
public final class BeatLabels {

    private static final String[] SUFFIX = {"", "+", "&", "a"};

    private BeatLabels() {}

    public static String of(int position) {
        int beat = position / MeasureGrid.SUBDIVISIONS_PER_BEAT + 1;
        return "Beat " + beat + SUFFIX[position % MeasureGrid.SUBDIVISIONS_PER_BEAT];
    }

    /**
     * One row of the rhythm grid: beat numbers on quarters, {@code +} on eighths,
     * {@code .} on sixteenths; cells with an onset are bracketed.
     */
    public static String gridRow(RhythmFingerprint rhythm) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < MeasureGrid.SUBDIVISIONS_PER_MEASURE; i++) {
            String marker;
            if (i % 4 == 0) {
                marker = String.valueOf(i / 4 + 1);
            } else if (i % 2 == 0) {
                marker = "+";
            } else {
                marker = ".";
            }
            sb.append(rhythm.contains(i) ? "[" + marker + "]" : " " + marker + " ");
        }
        return sb.toString();
    }
}
