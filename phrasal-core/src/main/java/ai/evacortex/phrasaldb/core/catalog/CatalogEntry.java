/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.catalog;

import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Corpus statistics of one rhythm fingerprint.
 *
 * @param fingerprint  the canonical one-measure rhythm
 * @param occurrences  measures carrying it, across all pieces
 * @param support      identifiers of the pieces containing it at least once
 */
public record CatalogEntry(RhythmFingerprint fingerprint, long occurrences, SortedSet<String> support) {

    public CatalogEntry {
        support = Collections.unmodifiableSortedSet(new TreeSet<>(support));
    }

    public int supportCount() {
        return support.size();
    }
}
