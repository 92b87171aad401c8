/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.exceptions;

public class InvalidNoteEventException extends RuntimeException {
    public InvalidNoteEventException(String message) {
        super("Invalid NoteEvent: " + message);
    }

    public InvalidNoteEventException(String message, Throwable cause) {
        super("Invalid NoteEvent: " + message, cause);
    }
}
