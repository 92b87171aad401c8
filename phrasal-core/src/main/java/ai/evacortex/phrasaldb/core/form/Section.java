/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.form;

/**
 * Maximal run of consecutive measures with one label. Measure numbers are
 * 1-indexed and inclusive.
 */
public record Section(String label, int startMeasure, int endMeasure, int length) {

    public Section {
        if (startMeasure < 1 || endMeasure < startMeasure || length != endMeasure - startMeasure + 1) {
            throw new IllegalArgumentException("Inconsistent section " + label + " [" + startMeasure
                    + ".." + endMeasure + "] length " + length);
        }
    }
}
