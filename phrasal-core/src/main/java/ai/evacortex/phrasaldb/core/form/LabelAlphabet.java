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
 * Display names for group ordinals: {@code A..Z}, then {@code AA, AB, .., AZ, BA, ..}
 * (bijective base 26, as spreadsheet columns). Ordinals are unbounded; only the
 * rendering grows.
 */
public final class LabelAlphabet {

    public static final int SINGLE_LETTER_LABELS = 26;

    private LabelAlphabet() {}

    public static String label(int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException("Negative label ordinal: " + ordinal);
        }
        StringBuilder sb = new StringBuilder();
        int n = ordinal + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + n % SINGLE_LETTER_LABELS));
            n /= SINGLE_LETTER_LABELS;
        }
        return sb.reverse().toString();
    }

    /** Inverse of {@link #label(int)}. */
    public static int ordinal(String label) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("Empty label");
        }
        int n = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Label '" + label + "' contains '" + c + "'");
            }
            n = Math.addExact(Math.multiplyExact(n, SINGLE_LETTER_LABELS), c - 'A' + 1);
        }
        return n - 1;
    }

    public static boolean isSingleLetter(int ordinal) {
        return ordinal >= 0 && ordinal < SINGLE_LETTER_LABELS;
    }
}
