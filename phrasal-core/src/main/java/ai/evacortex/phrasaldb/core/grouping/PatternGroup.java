/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.grouping;

import java.util.List;

/**
 * Measures sharing one exact fingerprint value.
 *
 * @param ordinal     discovery order of the group, starting at 0
 * @param fingerprint the shared value
 * @param measures    member indices in ascending order
 */
public record PatternGroup<F>(int ordinal, F fingerprint, List<Integer> measures) {

    public PatternGroup {
        measures = List.copyOf(measures);
    }

    public int firstMeasure() {
        return measures.get(0);
    }

    public int size() {
        return measures.size();
    }
}
