/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.midi;

import ai.evacortex.phrasaldb.core.NoteEvent;

import java.util.List;
import java.util.Optional;

/**
 * Note events of one track of a MIDI file.
 *
 * @param ppqn       ticks per quarter note, 0 for SMPTE-timed files
 * @param trackCount tracks present in the file
 * @param trackName  sequence/track name meta event of the decoded track, if any
 */
public record DecodedPiece(String source, int ppqn, int trackCount, Optional<String> trackName, List<NoteEvent> events) {

    public DecodedPiece {
        events = List.copyOf(events);
    }

    /** The same decoded content attributed to another file. */
    public DecodedPiece withSource(String source) {
        return new DecodedPiece(source, ppqn, trackCount, trackName, events);
    }

    public boolean isAnalyzable() {
        return ppqn > 0 && !events.isEmpty();
    }
}
