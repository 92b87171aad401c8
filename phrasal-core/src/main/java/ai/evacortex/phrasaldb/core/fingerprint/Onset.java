/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.fingerprint;

import java.util.Comparator;

/** A pitch struck at a sixteenth-note cell of a measure. */
public record Onset(int position, int pitch) implements Comparable<Onset> {

    private static final Comparator<Onset> ORDER =
            Comparator.comparingInt(Onset::position).thenComparingInt(Onset::pitch);

    @Override
    public int compareTo(Onset other) {
        return ORDER.compare(this, other);
    }
}
