/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.timeline;

import java.util.*;

/**
 * Absolute-time view of an event stream: which pitches start at which tick,
 * plus the per-pitch spans produced while pairing note-on and note-off events.
 *
 * <p>Instances are immutable. Pitch lists keep the order in which their onsets
 * were encountered; later stages sort them.</p>
 */
public final class Timeline {

    private static final Timeline EMPTY = new Timeline(new TreeMap<>(), Map.of(), 0, 0L);

    private final NavigableMap<Long, List<Integer>> onsetsByTick;
    private final Map<Integer, List<NoteSpan>> spansByPitch;
    private final int onsetCount;
    private final long endTick;

    Timeline(NavigableMap<Long, List<Integer>> onsetsByTick,
             Map<Integer, List<NoteSpan>> spansByPitch,
             int onsetCount,
             long endTick) {
        NavigableMap<Long, List<Integer>> onsets = new TreeMap<>();
        onsetsByTick.forEach((tick, pitches) -> onsets.put(tick, List.copyOf(pitches)));
        Map<Integer, List<NoteSpan>> spans = new TreeMap<>();
        spansByPitch.forEach((pitch, stack) -> spans.put(pitch, List.copyOf(stack)));
        this.onsetsByTick = Collections.unmodifiableNavigableMap(onsets);
        this.spansByPitch = Collections.unmodifiableMap(spans);
        this.onsetCount = onsetCount;
        this.endTick = endTick;
    }

    public static Timeline empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return onsetCount == 0;
    }

    /** Onset ticks in ascending order, each mapped to the pitches struck there. */
    public NavigableMap<Long, List<Integer>> onsetsByTick() {
        return onsetsByTick;
    }

    public NavigableSet<Long> onsetTicks() {
        return onsetsByTick.navigableKeySet();
    }

    /** Onsets in the half-open tick range {@code [fromTick, toTick)}. */
    public NavigableMap<Long, List<Integer>> onsetsBetween(long fromTick, long toTick) {
        return onsetsByTick.subMap(fromTick, true, toTick, false);
    }

    public Map<Integer, List<NoteSpan>> spansByPitch() {
        return spansByPitch;
    }

    public List<NoteSpan> spansOf(int pitch) {
        return spansByPitch.getOrDefault(pitch, List.of());
    }

    /** Number of note-on events, counting simultaneous onsets separately. */
    public int onsetCount() {
        return onsetCount;
    }

    public OptionalLong lastOnsetTick() {
        return onsetsByTick.isEmpty() ? OptionalLong.empty() : OptionalLong.of(onsetsByTick.lastKey());
    }

    /** Accumulated tick value after the last event of the stream. */
    public long endTick() {
        return endTick;
    }

    public OptionalInt lowestPitch() {
        return onsetsByTick.values().stream().flatMap(List::stream).mapToInt(Integer::intValue).min();
    }

    public OptionalInt highestPitch() {
        return onsetsByTick.values().stream().flatMap(List::stream).mapToInt(Integer::intValue).max();
    }
}
