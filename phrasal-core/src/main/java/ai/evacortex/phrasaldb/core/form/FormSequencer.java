/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.form;

import ai.evacortex.phrasaldb.core.grouping.Partition;

/** Turns a measure partition into a form string. */
public final class FormSequencer {

    private FormSequencer() {}

    public static FormString sequence(Partition<?> partition) {
        if (partition.measureCount() == 0) {
            return FormString.empty();
        }
        return FormString.of(partition.ordinals());
    }
}
