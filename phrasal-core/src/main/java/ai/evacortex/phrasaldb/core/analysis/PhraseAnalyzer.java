/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.analysis;

import ai.evacortex.phrasaldb.core.NoteEvent;
import ai.evacortex.phrasaldb.core.fingerprint.FingerprintExtractor;
import ai.evacortex.phrasaldb.core.fingerprint.MeasureFingerprint;
import ai.evacortex.phrasaldb.core.fingerprint.MelodyFingerprint;
import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;
import ai.evacortex.phrasaldb.core.form.FormSequencer;
import ai.evacortex.phrasaldb.core.form.FormString;
import ai.evacortex.phrasaldb.core.grid.MeasureGrid;
import ai.evacortex.phrasaldb.core.grouping.EquivalenceGrouper;
import ai.evacortex.phrasaldb.core.grouping.Partition;
import ai.evacortex.phrasaldb.core.timeline.Timeline;
import ai.evacortex.phrasaldb.core.timeline.TimelineBuilder;

import java.util.*;

/**
 * Single-piece pipeline: timeline, grid, fingerprints, grouping and form.
 *
 * <p>Stateless and thread-safe; pieces may be analyzed concurrently. Empty event
 * lists and non-positive resolutions are not errors, they produce
 * {@link PieceAnalysis#empty()}.</p>
 */
public final class PhraseAnalyzer {

    public static final int FREQUENT_PITCH_LIMIT = 5;

    private static final Comparator<PitchCount> BY_FREQUENCY =
            Comparator.comparingInt(PitchCount::count).reversed().thenComparingInt(PitchCount::pitch);

    public PieceAnalysis analyze(List<NoteEvent> events, int ppqn) {
        if (ppqn <= 0 || events == null || events.isEmpty()) {
            return PieceAnalysis.empty();
        }
        Timeline timeline = TimelineBuilder.build(events);
        if (timeline.isEmpty()) {
            return PieceAnalysis.empty();
        }
        MeasureGrid grid = new MeasureGrid(ppqn);
        List<MeasureFingerprint> measures = FingerprintExtractor.extract(timeline, grid);

        Partition<RhythmFingerprint> rhythmGroups =
                EquivalenceGrouper.group(measures.stream().map(MeasureFingerprint::rhythm).toList());
        Partition<MelodyFingerprint> melodyGroups =
                EquivalenceGrouper.group(measures.stream().map(MeasureFingerprint::melody).toList());
        FormString rhythmicForm = FormSequencer.sequence(rhythmGroups);
        FormString melodicForm = FormSequencer.sequence(melodyGroups);

        NoteRange range = new NoteRange(timeline.lowestPitch().orElseThrow(), timeline.highestPitch().orElseThrow());

        return new PieceAnalysis(ppqn,
                measures.size(),
                timeline.endTick(),
                timeline.lastOnsetTick().orElseThrow(),
                timeline.onsetCount(),
                measures,
                rhythmGroups,
                melodyGroups,
                rhythmicForm,
                melodicForm,
                melodicForm.sections(),
                Optional.of(range),
                frequentPitches(timeline));
    }

    static List<PitchCount> frequentPitches(Timeline timeline) {
        Map<Integer, Integer> counts = new HashMap<>();
        timeline.onsetsByTick().values().forEach(pitches ->
                pitches.forEach(p -> counts.merge(p, 1, Integer::sum)));
        return counts.entrySet().stream()
                .map(e -> new PitchCount(e.getKey(), e.getValue()))
                .sorted(BY_FREQUENCY)
                .limit(FREQUENT_PITCH_LIMIT)
                .toList();
    }
}
