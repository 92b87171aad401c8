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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.midi.*;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts note-on/note-off events of one track of a Standard MIDI File.
 *
 * <p>A NOTE_ON with velocity 0 is a release. Delta ticks are measured between
 * consecutive note events, so time spent on skipped messages (controllers, meta
 * events) is carried into the next note event. Files timed in SMPTE frames have no
 * quarter-note resolution and decode with {@code ppqn} 0.</p>
 */
public class MidiNoteDecoder {

    private static final Logger log = LoggerFactory.getLogger(MidiNoteDecoder.class);

    private static final int META_TRACK_NAME = 0x03;

    private final int trackIndex;

    public MidiNoteDecoder() {
        this(0);
    }

    public MidiNoteDecoder(int trackIndex) {
        if (trackIndex < 0) {
            throw new IllegalArgumentException("Negative track index: " + trackIndex);
        }
        this.trackIndex = trackIndex;
    }

    public int trackIndex() {
        return trackIndex;
    }

    public DecodedPiece decode(String source, byte[] data) throws MidiDecodeException {
        Sequence sequence;
        try {
            sequence = MidiSystem.getSequence(new ByteArrayInputStream(data));
        } catch (InvalidMidiDataException | IOException e) {
            throw new MidiDecodeException(source, e);
        }
        return decode(source, sequence);
    }

    public DecodedPiece decode(String source, Sequence sequence) {
        int ppqn = sequence.getDivisionType() == Sequence.PPQ ? sequence.getResolution() : 0;
        if (ppqn == 0) {
            log.debug("{} uses SMPTE timing ({} fps), no quarter-note grid", source, sequence.getDivisionType());
        }
        Track[] tracks = sequence.getTracks();
        if (trackIndex >= tracks.length) {
            log.debug("{} has {} track(s), track {} missing", source, tracks.length, trackIndex);
            return new DecodedPiece(source, ppqn, tracks.length, Optional.empty(), List.of());
        }

        Track track = tracks[trackIndex];
        List<NoteEvent> events = new ArrayList<>();
        String trackName = null;
        long previousTick = 0;

        for (int i = 0; i < track.size(); i++) {
            MidiEvent event = track.get(i);
            MidiMessage message = event.getMessage();
            if (message instanceof MetaMessage meta) {
                if (meta.getType() == META_TRACK_NAME && trackName == null) {
                    trackName = new String(meta.getData(), StandardCharsets.ISO_8859_1).trim();
                }
                continue;
            }
            if (!(message instanceof ShortMessage sm)) {
                continue;
            }
            NoteEvent.Kind kind = kindOf(sm);
            if (kind == null) {
                continue;
            }
            long tick = event.getTick();
            events.add(new NoteEvent(kind, sm.getData1(), Math.max(0, tick - previousTick)));
            previousTick = tick;
        }

        log.debug("{}: ppqn={}, track {} of {}, {} note event(s)", source, ppqn, trackIndex, tracks.length, events.size());
        return new DecodedPiece(source, ppqn, tracks.length,
                Optional.ofNullable(trackName).filter(n -> !n.isEmpty()), events);
    }

    private static NoteEvent.Kind kindOf(ShortMessage sm) {
        int command = sm.getCommand();
        if (command == ShortMessage.NOTE_ON) {
            return sm.getData2() > 0 ? NoteEvent.Kind.ON : NoteEvent.Kind.OFF;
        }
        if (command == ShortMessage.NOTE_OFF) {
            return NoteEvent.Kind.OFF;
        }
        return null;
    }
}
