/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.analysis;

import ai.evacortex.phrasaldb.core.fingerprint.MeasureFingerprint;
import ai.evacortex.phrasaldb.core.fingerprint.MelodyFingerprint;
import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;
import ai.evacortex.phrasaldb.core.form.FormString;
import ai.evacortex.phrasaldb.core.form.Section;
import ai.evacortex.phrasaldb.core.grouping.EquivalenceGrouper;
import ai.evacortex.phrasaldb.core.grouping.Partition;

import java.util.List;
import java.util.Optional;

/**
 * Everything derived from one piece. A piece without onsets (or without a usable
 * resolution) yields {@link #empty()}: zero measures, empty forms, no range.
 *
 * @param ppqn            resolution the piece was analyzed with, 0 when empty
 * @param measureCount    number of 4/4 measures up to the last onset
 * @param totalTicks      absolute tick reached by the last event
 * @param lastOnsetTick   absolute tick of the last onset, 0 when empty
 * @param onsetCount      note-on events, simultaneous onsets counted separately
 * @param measures        per-measure fingerprints, index order
 * @param rhythmGroups    partition of measures by rhythm fingerprint
 * @param melodyGroups    partition of measures by melody fingerprint
 * @param rhythmicForm    one label per measure from {@code rhythmGroups}
 * @param melodicForm     one label per measure from {@code melodyGroups}
 * @param sections        runs of the melodic form
 * @param noteRange       lowest and highest onset pitch, absent when empty
 * @param frequentPitches most frequent onset pitches, most frequent first
 */
public record PieceAnalysis(int ppqn,
                            int measureCount,
                            long totalTicks,
                            long lastOnsetTick,
                            int onsetCount,
                            List<MeasureFingerprint> measures,
                            Partition<RhythmFingerprint> rhythmGroups,
                            Partition<MelodyFingerprint> melodyGroups,
                            FormString rhythmicForm,
                            FormString melodicForm,
                            List<Section> sections,
                            Optional<NoteRange> noteRange,
                            List<PitchCount> frequentPitches) {

    private static final PieceAnalysis EMPTY = new PieceAnalysis(0, 0, 0L, 0L, 0, List.of(),
            EquivalenceGrouper.group(List.of()), EquivalenceGrouper.group(List.of()),
            FormString.empty(), FormString.empty(), List.of(), Optional.empty(), List.of());

    public PieceAnalysis {
        measures = List.copyOf(measures);
        sections = List.copyOf(sections);
        frequentPitches = List.copyOf(frequentPitches);
    }

    public static PieceAnalysis empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return measureCount == 0;
    }

    /** Average onsets per measure, 0 for an empty piece. */
    public double rhythmicDensity() {
        return measureCount == 0 ? 0.0 : (double) onsetCount / measureCount;
    }

    public boolean phrasingCoincides() {
        return rhythmicForm.equals(melodicForm);
    }

    /** Labels of the melodic sections in order, i.e. the melodic form with repeats collapsed. */
    public FormString overallForm() {
        return melodicForm.collapsed();
    }

    public List<RhythmFingerprint> rhythmFingerprints() {
        return measures.stream().map(MeasureFingerprint::rhythm).toList();
    }

    public double durationInQuarters() {
        return ppqn == 0 ? 0.0 : (double) totalTicks / ppqn;
    }

    /** Position of the last onset in quarter notes, 0 for an empty piece. */
    public double lastOnsetInQuarters() {
        return ppqn == 0 ? 0.0 : (double) lastOnsetTick / ppqn;
    }
}
