/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.report;

import ai.evacortex.phrasaldb.cli.batch.PieceResult;
import ai.evacortex.phrasaldb.cli.midi.DecodedPiece;
import ai.evacortex.phrasaldb.core.analysis.NoteRange;
import ai.evacortex.phrasaldb.core.analysis.PieceAnalysis;
import ai.evacortex.phrasaldb.core.analysis.PitchCount;
import ai.evacortex.phrasaldb.core.fingerprint.MeasureFingerprint;
import ai.evacortex.phrasaldb.core.fingerprint.Onset;
import ai.evacortex.phrasaldb.core.form.Section;

import java.io.PrintStream;
import java.util.Locale;

/** Human-readable report of one analyzed piece. */
public class PieceReportPrinter {

    private static final String RULE = "=".repeat(80);

    private final PrintStream out;
    private final boolean details;

    public PieceReportPrinter(PrintStream out, boolean details) {
        this.out = out;
        this.details = details;
    }

    public void print(PieceResult result) {
        out.println();
        out.println(RULE);
        out.println("Processing: " + result.pieceId());
        out.println(RULE);

        if (result.status() == PieceResult.Status.FAILED) {
            out.println("Could not analyze " + result.pieceId() + ": " + result.error().orElse("unknown error"));
            return;
        }
        DecodedPiece piece = result.piece().orElseThrow();
        out.println("PPQN (Pulses Per Quarter Note): " + piece.ppqn());
        piece.trackName().ifPresent(name -> out.println("Track name: " + name));
        out.println("Note events: " + piece.events().size());

        PieceAnalysis analysis = result.analysis();
        if (analysis.isEmpty()) {
            out.println("No note events to analyze");
            return;
        }
        printRhythm(analysis);
        if (details) {
            printMelodyDetails(analysis);
        }
        printCombined(analysis);
    }

    private void printRhythm(PieceAnalysis analysis) {
        int ppqn = analysis.ppqn();
        out.println();
        out.println("--- RHYTHM PHRASAL STRUCTURE ANALYSIS ---");
        out.println("Total measures: " + analysis.measureCount());
        out.printf(Locale.ROOT, "Total duration: %d ticks (%.2f quarter notes) to the last onset%n",
                analysis.lastOnsetTick(), analysis.lastOnsetInQuarters());
        out.printf(Locale.ROOT, "End tick: %d (%.2f quarter notes)%n",
                analysis.totalTicks(), analysis.durationInQuarters());
        out.printf(Locale.ROOT, "Quarter note = %d ticks, eighth = %.1f, 16th = %.1f%n",
                ppqn, ppqn / 2.0, ppqn / 4.0);
        out.println();
        out.println("Rhythm grid (measures x beats):");
        for (MeasureFingerprint measure : analysis.measures()) {
            out.printf(Locale.ROOT, "Measure %3d: %s  %s%n", measure.index() + 1,
                    BeatLabels.gridRow(measure.rhythm()), analysis.rhythmicForm().labelAt(measure.index()));
        }
    }

    private void printMelodyDetails(PieceAnalysis analysis) {
        out.println();
        out.println("--- MELODIC SEQUENCES ---");
        for (MeasureFingerprint measure : analysis.measures()) {
            out.println("Measure " + (measure.index() + 1) + " ("
                    + analysis.melodicForm().labelAt(measure.index()) + "):");
            for (Onset onset : measure.melody().onsets()) {
                out.printf(Locale.ROOT, "  %-8s %-4s (%d)%n",
                        BeatLabels.of(onset.position()), NoteNames.of(onset.pitch()), onset.pitch());
            }
        }
    }

    private void printCombined(PieceAnalysis analysis) {
        out.println();
        out.println("--- COMBINED RHYTHM AND MELODIC ANALYSIS ---");
        if (analysis.phrasingCoincides()) {
            out.println("The rhythmic and melodic patterns match exactly.");
            out.println("  Pattern:  " + analysis.rhythmicForm().render());
        } else {
            out.println("The rhythmic and melodic patterns differ:");
            out.println("  Rhythmic: " + analysis.rhythmicForm().render());
            out.println("  Melodic:  " + analysis.melodicForm().render());
        }

        NoteRange range = analysis.noteRange().orElseThrow();
        out.println();
        out.println("Note range: " + NoteNames.of(range.lowest()) + " to " + NoteNames.of(range.highest()));
        out.printf(Locale.ROOT, "Rhythmic density: %.2f onsets per measure%n", analysis.rhythmicDensity());

        out.println("Most frequent notes (MIDI number: count):");
        for (PitchCount pc : analysis.frequentPitches()) {
            out.printf(Locale.ROOT, "  %d (%s): %d times%n", pc.pitch(), NoteNames.of(pc.pitch()), pc.count());
        }

        out.println();
        out.println("Sections:");
        for (Section s : analysis.sections()) {
            out.printf(Locale.ROOT, "  %s: measures %d-%d (%d)%n", s.label(), s.startMeasure(), s.endMeasure(), s.length());
        }
        out.println("Overall melodic form: " + analysis.overallForm().render());
    }
}
