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
import ai.evacortex.phrasaldb.core.timeline.Timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Derives per-measure rhythm and melody fingerprints from a timeline. Pure: the
 * same timeline and grid always yield equal fingerprints.
 */
public final class FingerprintExtractor {

    private FingerprintExtractor() {}

    public static List<MeasureFingerprint> extract(Timeline timeline, MeasureGrid grid) {
        if (timeline.isEmpty()) {
            return List.of();
        }
        int measureCount = grid.measureCount(timeline.lastOnsetTick().orElseThrow());
        List<MeasureFingerprint> measures = new ArrayList<>(measureCount);
        for (int m = 0; m < measureCount; m++) {
            measures.add(extractMeasure(m, timeline, grid));
        }
        return Collections.unmodifiableList(measures);
    }

    static MeasureFingerprint extractMeasure(int measureIndex, Timeline timeline, MeasureGrid grid) {
        RhythmFingerprint rhythm = RhythmFingerprint.empty();
        List<Onset> onsets = new ArrayList<>();
        Map<Long, List<Integer>> inMeasure =
                timeline.onsetsBetween(grid.measureStart(measureIndex), grid.measureEnd(measureIndex));

        for (Map.Entry<Long, List<Integer>> entry : inMeasure.entrySet()) {
            int position = grid.subdivisionOf(entry.getKey());
            rhythm = rhythm.with(position);
            entry.getValue().stream().sorted().forEach(pitch -> onsets.add(new Onset(position, pitch)));
        }
        return new MeasureFingerprint(measureIndex, rhythm, MelodyFingerprint.of(onsets));
    }
}
