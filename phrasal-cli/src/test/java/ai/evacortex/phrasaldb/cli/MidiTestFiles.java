/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli;

import javax.sound.midi.*;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small Standard MIDI Files for tests.
 */
public class MidiTestFiles {

    /** A note: absolute start tick, length in ticks and pitch. */
    public record Note(long tick, long length, int pitch) {}

    public static Note note(long tick, long length, int pitch) {
        return new Note(tick, length, pitch);
    }

    public static Sequence sequence(int ppqn, String trackName, Note... notes) {
        try {
            Sequence seq = new Sequence(Sequence.PPQ, ppqn);
            Track track = seq.createTrack();
            if (trackName != null) {
                byte[] name = trackName.getBytes();
                track.add(new MidiEvent(new MetaMessage(0x03, name, name.length), 0));
            }
            for (Note n : notes) {
                track.add(shortEvent(ShortMessage.NOTE_ON, n.pitch(), 100, n.tick()));
                track.add(shortEvent(ShortMessage.NOTE_OFF, n.pitch(), 0, n.tick() + n.length()));
            }
            return seq;
        } catch (InvalidMidiDataException e) {
            throw new IllegalStateException("Cannot build test sequence", e);
        }
    }

    public static MidiEvent shortEvent(int command, int pitch, int velocity, long tick) {
        try {
            return new MidiEvent(new ShortMessage(command, 0, pitch, velocity), tick);
        } catch (InvalidMidiDataException e) {
            throw new IllegalStateException("Cannot build MIDI message", e);
        }
    }

    public static byte[] toBytes(Sequence seq) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MidiSystem.write(seq, 1, out);
        return out.toByteArray();
    }

    public static Path write(Path file, Sequence seq) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.write(file, toBytes(seq));
        return file;
    }

    /** Quarter notes on every beat of {@code measures} measures, all on {@code pitch}. */
    public static Sequence quarters(int ppqn, int measures, int pitch) {
        Note[] notes = new Note[measures * 4];
        for (int i = 0; i < notes.length; i++) {
            notes[i] = note((long) i * ppqn, ppqn / 2, pitch);
        }
        return sequence(ppqn, null, notes);
    }
}
