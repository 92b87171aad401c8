/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.report;

import ai.evacortex.phrasaldb.core.catalog.CatalogEntry;
import ai.evacortex.phrasaldb.core.catalog.PatternCatalog;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/** Ranked table of the most widespread one-measure rhythms of a corpus. */
public class CorpusReportPrinter {

    private final PrintStream out;

    public CorpusReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(PatternCatalog catalog, int top) {
        out.println();
        out.println("--- CORPUS RHYTHM PATTERNS ---");
        out.printf(Locale.ROOT, "Pieces: %d, distinct patterns: %d, measures: %d%n",
                catalog.pieceIds().size(), catalog.size(), catalog.totalOccurrences());
        if (catalog.isEmpty()) {
            out.println("No patterns collected");
            return;
        }
        List<CatalogEntry> rows = catalog.top(top);
        out.printf(Locale.ROOT, "%4s  %7s  %11s  %s%n", "rank", "pieces", "occurrences", "pattern");
        for (int i = 0; i < rows.size(); i++) {
            CatalogEntry entry = rows.get(i);
            out.printf(Locale.ROOT, "%4d  %7d  %11d  %s %s%n", i + 1, entry.supportCount(), entry.occurrences(),
                    BeatLabels.gridRow(entry.fingerprint()), entry.fingerprint());
        }
        if (rows.size() < catalog.size()) {
            out.println("... " + (catalog.size() - rows.size()) + " more");
        }
    }
}
