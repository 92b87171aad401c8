/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.timeline;

import ai.evacortex.phrasaldb.core.NoteEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Converts a relative-time event stream into a {@link Timeline}.
 *
 * <p>Note-off events close the most recently opened span of their pitch, so a
 * pitch re-struck before its release pairs correctly. A note-off without an open
 * span is ignored.</p>
 */
public final class TimelineBuilder {

    private static final Logger log = LoggerFactory.getLogger(TimelineBuilder.class);

    private final NavigableMap<Long, List<Integer>> onsetsByTick = new TreeMap<>();
    private final Map<Integer, List<NoteSpan>> spansByPitch = new HashMap<>();
    private final Map<Integer, Deque<NoteSpan>> openByPitch = new HashMap<>();
    private long cursor;
    private int onsetCount;
    private int unmatchedOffs;

    private TimelineBuilder() {}

    public static Timeline build(List<NoteEvent> events) {
        if (events == null || events.isEmpty()) {
            return Timeline.empty();
        }
        TimelineBuilder builder = new TimelineBuilder();
        for (NoteEvent event : events) {
            builder.apply(event);
        }
        if (builder.unmatchedOffs > 0) {
            log.debug("Ignored {} note-off event(s) without an open note", builder.unmatchedOffs);
        }
        return new Timeline(builder.onsetsByTick, builder.spansByPitch, builder.onsetCount, builder.cursor);
    }

    private void apply(NoteEvent event) {
        cursor += event.deltaTicks();
        int pitch = event.pitch();
        if (event.isOn()) {
            onsetsByTick.computeIfAbsent(cursor, t -> new ArrayList<>()).add(pitch);
            NoteSpan span = new NoteSpan(pitch, cursor);
            spansByPitch.computeIfAbsent(pitch, p -> new ArrayList<>()).add(span);
            openByPitch.computeIfAbsent(pitch, p -> new ArrayDeque<>()).push(span);
            onsetCount++;
        } else {
            Deque<NoteSpan> open = openByPitch.get(pitch);
            if (open == null || open.isEmpty()) {
                unmatchedOffs++;
                return;
            }
            open.pop().close(cursor);
        }
    }
}
