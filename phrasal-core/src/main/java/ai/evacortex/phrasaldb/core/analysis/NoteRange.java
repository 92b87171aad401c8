/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.analysis;

/** Lowest and highest onset pitch of a piece. */
public record NoteRange(int lowest, int highest) {

    public NoteRange {
        if (lowest > highest) {
            throw new IllegalArgumentException("lowest " + lowest + " above highest " + highest);
        }
    }

    public int span() {
        return highest - lowest;
    }
}
