/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.timeline;

import java.util.OptionalLong;

/**
 * Sounding interval of one struck note. The end stays open until a matching
 * note-off closes it; a span is closed at most once.
 */
public final class NoteSpan {

    private static final long OPEN = -1L;

    private final int pitch;
    private final long startTick;
    private long endTick = OPEN;

    NoteSpan(int pitch, long startTick) {
        this.pitch = pitch;
        this.startTick = startTick;
    }

    public int pitch() {
        return pitch;
    }

    public long startTick() {
        return startTick;
    }

    public OptionalLong endTick() {
        return endTick == OPEN ? OptionalLong.empty() : OptionalLong.of(endTick);
    }

    public boolean isOpen() {
        return endTick == OPEN;
    }

    void close(long tick) {
        if (!isOpen()) {
            throw new IllegalStateException("Span for pitch " + pitch + " already closed at " + endTick);
        }
        this.endTick = tick;
    }

    @Override
    public String toString() {
        return "NoteSpan[pitch=" + pitch + ", start=" + startTick
                + ", end=" + (isOpen() ? "open" : String.valueOf(endTick)) + "]";
    }
}
