/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.grouping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups measures whose fingerprints are exactly equal.
 *
 * <p>Works for any fingerprint type with value {@code equals}/{@code hashCode}.
 * Measures are visited in index order and every measure joins the group of the
 * first measure carrying the same value, so group ordinals follow the index of
 * each group's lowest member and every measure lands in exactly one group.</p>
 */
public final class EquivalenceGrouper {

    private EquivalenceGrouper() {}

    public static <F> Partition<F> group(List<F> fingerprints) {
        Map<F, Integer> ordinalByValue = new LinkedHashMap<>();
        List<List<Integer>> members = new ArrayList<>();
        int[] ordinalByMeasure = new int[fingerprints.size()];

        for (int m = 0; m < fingerprints.size(); m++) {
            F value = fingerprints.get(m);
            if (value == null) {
                throw new IllegalArgumentException("Missing fingerprint for measure " + m);
            }
            Integer ordinal = ordinalByValue.get(value);
            if (ordinal == null) {
                ordinal = members.size();
                ordinalByValue.put(value, ordinal);
                members.add(new ArrayList<>());
            }
            members.get(ordinal).add(m);
            ordinalByMeasure[m] = ordinal;
        }

        List<PatternGroup<F>> groups = new ArrayList<>(members.size());
        for (Map.Entry<F, Integer> entry : ordinalByValue.entrySet()) {
            int ordinal = entry.getValue();
            groups.add(new PatternGroup<>(ordinal, entry.getKey(), members.get(ordinal)));
        }
        return new Partition<>(groups, ordinalByMeasure);
    }
}
