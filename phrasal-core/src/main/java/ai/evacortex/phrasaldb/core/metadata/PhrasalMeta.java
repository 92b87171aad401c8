/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.metadata;

import ai.evacortex.phrasaldb.core.analysis.PieceAnalysis;

/**
 * The {@code "phrasal"} block of a piece's side-file:
 * <pre>
 * { "phrasal": { "rhythmic": { "pattern": "AABA" },
 *                "melodic":  { "pattern": "ABCA" } } }
 * </pre>
 */
public record PhrasalMeta(Layer rhythmic, Layer melodic) {

    public record Layer(String pattern) {}

    public static PhrasalMeta of(PieceAnalysis analysis) {
        return new PhrasalMeta(new Layer(analysis.rhythmicForm().render()),
                new Layer(analysis.melodicForm().render()));
    }
}
