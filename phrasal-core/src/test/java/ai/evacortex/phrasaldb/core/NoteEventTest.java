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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoteEventTest {

    @Test
    void testFactoriesSetKind() {
        assertTrue(NoteEvent.on(60, 0).isOn());
        assertFalse(NoteEvent.off(60, 10).isOn());
        assertEquals(10, NoteEvent.off(60, 10).deltaTicks());
    }

    @Test
    void testRejectsOutOfRangeValues() {
        assertThrows(InvalidNoteEventException.class, () -> NoteEvent.on(128, 0));
        assertThrows(InvalidNoteEventException.class, () -> NoteEvent.on(-1, 0));
        assertThrows(InvalidNoteEventException.class, () -> NoteEvent.off(60, -5));
        assertThrows(InvalidNoteEventException.class, () -> new NoteEvent(null, 60, 0));
    }
}
