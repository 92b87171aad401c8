/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.exceptions;

public class MetadataPersistenceException extends RuntimeException {
    public MetadataPersistenceException(String path, Throwable cause) {
        super("Failed to persist metadata at '" + path + "'", cause);
    }
}
