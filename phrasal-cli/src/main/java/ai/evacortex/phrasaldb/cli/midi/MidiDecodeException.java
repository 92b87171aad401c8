/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.midi;

public class MidiDecodeException extends Exception {
    public MidiDecodeException(String source, Throwable cause) {
        super("Cannot decode MIDI file '" + source + "': " + cause.getMessage(), cause);
    }

    public MidiDecodeException(String source, String reason) {
        super("Cannot decode MIDI file '" + source + "': " + reason);
    }
}
