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
import ai.evacortex.phrasaldb.core.NoteEventTestUtils;
import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;
import ai.evacortex.phrasaldb.core.form.Section;
import ai.evacortex.phrasaldb.core.grouping.PatternGroup;
import ai.evacortex.phrasaldb.core.grouping.Partition;
import org.junit.jupiter.api.Test;

import java.util.*;

import static ai.evacortex.phrasaldb.core.NoteEvent.off;
import static ai.evacortex.phrasaldb.core.NoteEvent.on;
import static org.junit.jupiter.api.Assertions.*;

class PhraseAnalyzerTest {

    private static final int[] QUARTERS = {0, 4, 8, 12};
    private static final int[] SYNCOPATED = {0, 2, 8, 12};

    private final PhraseAnalyzer analyzer = new PhraseAnalyzer();

    @Test
    void testSingleNote() {
        PieceAnalysis analysis = analyzer.analyze(List.of(on(60, 0), off(60, 128)), 128);

        assertEquals(1, analysis.measureCount());
        assertEquals(List.of(RhythmFingerprint.of(0)), analysis.rhythmFingerprints());
        assertEquals("A", analysis.rhythmicForm().render());
        assertEquals("A", analysis.melodicForm().render());
        assertEquals(List.of(new Section("A", 1, 1, 1)), analysis.sections());
        assertEquals(new NoteRange(60, 60), analysis.noteRange().orElseThrow());
        assertEquals(1.0, analysis.rhythmicDensity(), 1e-9);
        assertEquals(128L, analysis.totalTicks());
        assertEquals(0L, analysis.lastOnsetTick());
    }

    @Test
    void testRepeatedMeasuresFormOneGroup() {
        PieceAnalysis analysis = analyzer.analyze(NoteEventTestUtils.rhythm(128, 60, QUARTERS, QUARTERS), 128);

        assertEquals("AA", analysis.rhythmicForm().render());
        assertEquals(1, analysis.rhythmGroups().groupCount());
        assertEquals(List.of(new Section("A", 1, 2, 2)), analysis.sections());
        assertEquals("A", analysis.overallForm().render());
    }

    @Test
    void testContrastingMiddleMeasure() {
        PieceAnalysis analysis = analyzer.analyze(
                NoteEventTestUtils.rhythm(128, 60, QUARTERS, SYNCOPATED, QUARTERS), 128);

        assertEquals("ABA", analysis.rhythmicForm().render());
        assertEquals(2, analysis.rhythmGroups().groupCount());
        assertEquals(List.of(
                new Section("A", 1, 1, 1),
                new Section("B", 2, 2, 1),
                new Section("A", 3, 3, 1)), analysis.sections());
        assertTrue(analysis.phrasingCoincides());
    }

    @Test
    void testRhythmAndMelodyCanDiffer() {
        PieceAnalysis analysis = analyzer.analyze(NoteEventTestUtils.alternatingPhrase(), 128);

        assertEquals(4, analysis.measureCount());
        assertEquals("AAAA", analysis.rhythmicForm().render());
        assertEquals("ABAB", analysis.melodicForm().render());
        assertFalse(analysis.phrasingCoincides());
        assertEquals("ABAB", analysis.overallForm().render());
        assertEquals(List.of(
                new Section("A", 1, 1, 1),
                new Section("B", 2, 2, 1),
                new Section("A", 3, 3, 1),
                new Section("B", 4, 4, 1)), analysis.sections());
        assertEquals(RhythmFingerprint.of(0, 4, 7, 10, 11, 12, 14), analysis.rhythmFingerprints().get(0));
        assertEquals(28, analysis.onsetCount());
        assertEquals(7.0, analysis.rhythmicDensity(), 1e-9);
        assertEquals(new NoteRange(52, 62), analysis.noteRange().orElseThrow());
        assertEquals(2048L, analysis.totalTicks());
        assertEquals(16.0, analysis.durationInQuarters(), 1e-9);
        assertEquals(1984L, analysis.lastOnsetTick());
        assertEquals(15.5, analysis.lastOnsetInQuarters(), 1e-9);
    }

    @Test
    void testFrequentPitchesOrderedByCountThenPitch() {
        PieceAnalysis analysis = analyzer.analyze(NoteEventTestUtils.alternatingPhrase(), 128);

        assertEquals(List.of(
                new PitchCount(52, 14),
                new PitchCount(55, 4),
                new PitchCount(59, 4),
                new PitchCount(60, 4),
                new PitchCount(62, 2)), analysis.frequentPitches());
    }

    @Test
    void testPartitionsCoverEveryMeasure() {
        PieceAnalysis analysis = analyzer.analyze(NoteEventTestUtils.notes(96,
                new int[]{0, 0, 60}, new int[]{0, 8, 64},
                new int[]{1, 0, 60}, new int[]{1, 8, 65},
                new int[]{3, 0, 60}, new int[]{3, 8, 64},
                new int[]{4, 4, 60}), 96);

        assertEquals(5, analysis.measureCount());
        assertEquals(analysis.measureCount(), analysis.rhythmicForm().length());
        assertEquals(analysis.measureCount(), analysis.melodicForm().length());
        assertCovers(analysis.rhythmGroups(), analysis.measureCount());
        assertCovers(analysis.melodyGroups(), analysis.measureCount());
        assertEquals("AABAC", analysis.rhythmicForm().render());
        assertEquals("ABCAD", analysis.melodicForm().render());
    }

    @Test
    void testNothingToAnalyze() {
        assertTrue(analyzer.analyze(List.of(), 480).isEmpty());
        assertTrue(analyzer.analyze(null, 480).isEmpty());
        assertTrue(analyzer.analyze(List.of(on(60, 0), off(60, 10)), 0).isEmpty());
        assertTrue(analyzer.analyze(List.of(off(60, 10)), 480).isEmpty());

        PieceAnalysis empty = PieceAnalysis.empty();
        assertEquals(0, empty.measureCount());
        assertEquals("", empty.rhythmicForm().render());
        assertTrue(empty.sections().isEmpty());
        assertTrue(empty.noteRange().isEmpty());
        assertEquals(0.0, empty.rhythmicDensity());
    }

    @Test
    void testMalformedOffDoesNotDisturbOtherPitches() {
        List<NoteEvent> clean = List.of(on(60, 0), off(60, 64), on(64, 64), off(64, 64));
        List<NoteEvent> noisy = List.of(off(72, 0), on(60, 0), off(60, 64), off(71, 0), on(64, 64), off(64, 64));

        PieceAnalysis a = analyzer.analyze(clean, 128);
        PieceAnalysis b = assertDoesNotThrow(() -> analyzer.analyze(noisy, 128));
        assertEquals(a.measures(), b.measures());
        assertEquals(a.melodicForm(), b.melodicForm());
    }

    private static void assertCovers(Partition<?> partition, int measureCount) {
        Set<Integer> seen = new HashSet<>();
        for (PatternGroup<?> group : partition.groups()) {
            for (int m : group.measures()) {
                assertTrue(seen.add(m), "measure " + m + " grouped twice");
            }
        }
        assertEquals(measureCount, seen.size());
    }
}
