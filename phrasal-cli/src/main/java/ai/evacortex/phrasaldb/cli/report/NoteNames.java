/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.report;

/** Scientific pitch names, MIDI 60 = C4. */
public final class NoteNames {

    private static final String[] NAMES = {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};

    private NoteNames() {}

    public static String of(int midiNote) {
        if (midiNote < 0 || midiNote > 127) return "???";
        int octave = midiNote / 12 - 1;
        return NAMES[midiNote % 12] + octave;
    }
}
