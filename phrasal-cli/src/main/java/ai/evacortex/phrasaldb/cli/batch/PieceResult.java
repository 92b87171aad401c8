/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.batch;

import ai.evacortex.phrasaldb.cli.midi.DecodedPiece;
import ai.evacortex.phrasaldb.core.analysis.PieceAnalysis;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome for one file of a batch. A failed file carries no piece and an empty
 * analysis.
 */
public record PieceResult(Path file,
                          String pieceId,
                          Status status,
                          Optional<DecodedPiece> piece,
                          PieceAnalysis analysis,
                          Optional<String> error) {

    public enum Status {
        /** At least one measure was analyzed. */
        ANALYZED,
        /** Decoded, but nothing to analyze (no notes or no quarter-note resolution). */
        EMPTY,
        /** Could not be read or decoded. */
        FAILED
    }

    public static PieceResult analyzed(Path file, String pieceId, DecodedPiece piece, PieceAnalysis analysis) {
        Status status = analysis.isEmpty() ? Status.EMPTY : Status.ANALYZED;
        return new PieceResult(file, pieceId, status, Optional.of(piece), analysis, Optional.empty());
    }

    public static PieceResult failed(Path file, String pieceId, String error) {
        return new PieceResult(file, pieceId, Status.FAILED, Optional.empty(), PieceAnalysis.empty(), Optional.of(error));
    }
}
