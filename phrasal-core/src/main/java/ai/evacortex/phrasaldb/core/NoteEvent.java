/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core;

import ai.evacortex.phrasaldb.core.exceptions.InvalidNoteEventException;

/**
 * A single note-on or note-off message as delivered by a decoder.
 *
 * <p>{@code deltaTicks} is relative to the previous event of the stream (or to the
 * start of the stream for the first event), never absolute.</p>
 */
public record NoteEvent(Kind kind, int pitch, long deltaTicks) {

    public static final int MIN_PITCH = 0;
    public static final int MAX_PITCH = 127;

    public enum Kind { ON, OFF }

    public NoteEvent {
        if (kind == null) {
            throw new InvalidNoteEventException("kind must not be null");
        }
        if (pitch < MIN_PITCH || pitch > MAX_PITCH) {
            throw new InvalidNoteEventException("pitch " + pitch + " outside " + MIN_PITCH + ".." + MAX_PITCH);
        }
        if (deltaTicks < 0) {
            throw new InvalidNoteEventException("negative deltaTicks " + deltaTicks);
        }
    }

    public static NoteEvent on(int pitch, long deltaTicks) {
        return new NoteEvent(Kind.ON, pitch, deltaTicks);
    }

    public static NoteEvent off(int pitch, long deltaTicks) {
        return new NoteEvent(Kind.OFF, pitch, deltaTicks);
    }

    public boolean isOn() {
        return kind == Kind.ON;
    }
}
