/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.fingerprint;

/** Both fingerprints of the measure at zero-based {@code index}. */
public record MeasureFingerprint(int index, RhythmFingerprint rhythm, MelodyFingerprint melody) {}
