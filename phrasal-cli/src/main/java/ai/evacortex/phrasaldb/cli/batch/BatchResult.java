/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.batch;

import ai.evacortex.phrasaldb.core.catalog.PatternCatalog;

import java.util.List;

/** Per-file outcomes in scan order, plus the corpus catalog built from them. */
public record BatchResult(List<PieceResult> pieces, PatternCatalog catalog) {

    public BatchResult {
        pieces = List.copyOf(pieces);
    }

    public long count(PieceResult.Status status) {
        return pieces.stream().filter(p -> p.status() == status).count();
    }

    public List<PieceResult> failures() {
        return pieces.stream().filter(p -> p.status() == PieceResult.Status.FAILED).toList();
    }
}
