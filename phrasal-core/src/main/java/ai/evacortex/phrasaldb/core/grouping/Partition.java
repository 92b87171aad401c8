/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.grouping;

import java.util.Arrays;
import java.util.List;

/**
 * Partition of the measure range {@code [0, measureCount)} into pattern groups,
 * with a lookup from measure index to group ordinal.
 */
public final class Partition<F> {

    private final List<PatternGroup<F>> groups;
    private final int[] ordinalByMeasure;

    Partition(List<PatternGroup<F>> groups, int[] ordinalByMeasure) {
        this.groups = List.copyOf(groups);
        this.ordinalByMeasure = ordinalByMeasure;
    }

    public List<PatternGroup<F>> groups() {
        return groups;
    }

    public int groupCount() {
        return groups.size();
    }

    public int measureCount() {
        return ordinalByMeasure.length;
    }

    public int ordinalOf(int measureIndex) {
        return ordinalByMeasure[measureIndex];
    }

    public PatternGroup<F> groupOf(int measureIndex) {
        return groups.get(ordinalByMeasure[measureIndex]);
    }

    /** Group ordinal per measure, in measure order. */
    public int[] ordinals() {
        return ordinalByMeasure.clone();
    }

    @Override
    public String toString() {
        return "Partition" + Arrays.toString(ordinalByMeasure);
    }
}
