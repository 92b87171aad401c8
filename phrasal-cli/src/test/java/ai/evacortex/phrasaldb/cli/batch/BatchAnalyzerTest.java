/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.batch;

import ai.evacortex.phrasaldb.cli.MidiTestFiles;
import ai.evacortex.phrasaldb.core.catalog.CatalogEntry;
import ai.evacortex.phrasaldb.core.catalog.PatternCatalog;
import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;
import ai.evacortex.phrasaldb.core.metadata.PhrasalMeta;
import ai.evacortex.phrasaldb.core.metadata.PieceMetaStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static ai.evacortex.phrasaldb.cli.MidiTestFiles.note;
import static org.junit.jupiter.api.Assertions.*;

class BatchAnalyzerTest {

    private static final RhythmFingerprint QUARTERS = RhythmFingerprint.of(0, 4, 8, 12);
    private static final RhythmFingerprint EIGHTHS = RhythmFingerprint.of(0, 2, 4, 6, 8, 10, 12, 14);

    @TempDir Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        MidiTestFiles.write(tempDir.resolve("a.mid"), MidiTestFiles.quarters(96, 2, 60));
        Files.copy(tempDir.resolve("a.mid"), Files.createDirectories(tempDir.resolve("b")).resolve("copy.mid"));
        MidiTestFiles.write(tempDir.resolve("c.mid"), MidiTestFiles.sequence(96, "Eighths",
                IntStream.range(0, 8).mapToObj(i -> note(i * 48L, 24, 67)).toArray(MidiTestFiles.Note[]::new)));
        MidiTestFiles.write(tempDir.resolve("empty.mid"), MidiTestFiles.sequence(96, "Silence"));
        Files.writeString(tempDir.resolve("broken.mid"), "MThd but not really");
    }

    @Test
    void testAnalyzesCorpusAndIsolatesFailures() throws IOException {
        BatchResult result;
        try (BatchAnalyzer batch = new BatchAnalyzer(BatchOptions.defaultOptions().withThreads(3))) {
            result = batch.run(tempDir);
        }

        assertEquals(List.of("a.mid", "b/copy.mid", "broken.mid", "c.mid", "empty.mid"),
                result.pieces().stream().map(PieceResult::pieceId).toList());
        assertEquals(3, result.count(PieceResult.Status.ANALYZED));
        assertEquals(1, result.count(PieceResult.Status.EMPTY));
        assertEquals(1, result.failures().size());

        PieceResult broken = result.failures().get(0);
        assertEquals("broken.mid", broken.pieceId());
        assertTrue(broken.error().orElseThrow().contains("broken.mid"));
        assertTrue(broken.analysis().isEmpty());

        PieceResult first = result.pieces().get(0);
        assertEquals("AA", first.analysis().rhythmicForm().render());
        assertEquals(96, first.piece().orElseThrow().ppqn());
    }

    @Test
    void testIdenticalFilesCountAsSeparatePieces() throws IOException {
        PatternCatalog catalog;
        try (BatchAnalyzer batch = new BatchAnalyzer(BatchOptions.defaultOptions().withWriteMetadata(false))) {
            catalog = batch.run(tempDir).catalog();
        }

        CatalogEntry quarters = catalog.entry(QUARTERS).orElseThrow();
        assertEquals(4, quarters.occurrences());
        assertEquals(Set.of("a.mid", "b/copy.mid"), quarters.support());

        CatalogEntry eighths = catalog.entry(EIGHTHS).orElseThrow();
        assertEquals(1, eighths.occurrences());
        assertEquals(Set.of("c.mid"), eighths.support());

        assertEquals(List.of(quarters, eighths), catalog.ranked());
        assertEquals(Set.of("a.mid", "b/copy.mid", "c.mid", "empty.mid"), catalog.pieceIds());
    }

    @Test
    void testSingleThreadGivesSameCatalog() throws IOException {
        PatternCatalog parallel;
        PatternCatalog serial;
        BatchOptions options = BatchOptions.defaultOptions().withWriteMetadata(false);
        try (BatchAnalyzer batch = new BatchAnalyzer(options.withThreads(4))) {
            parallel = batch.run(tempDir).catalog();
        }
        try (BatchAnalyzer batch = new BatchAnalyzer(options.withThreads(1))) {
            serial = batch.run(tempDir).catalog();
        }
        assertEquals(serial.snapshot(), parallel.snapshot());
    }

    @Test
    void testWritesSideFilesForAnalyzedPieces() throws IOException {
        try (BatchAnalyzer batch = new BatchAnalyzer(BatchOptions.defaultOptions())) {
            batch.run(tempDir);
        }
        PieceMetaStore store = new PieceMetaStore();

        PhrasalMeta a = store.read(tempDir.resolve("a.json")).orElseThrow();
        assertEquals("AA", a.rhythmic().pattern());
        assertEquals("AA", a.melodic().pattern());
        assertTrue(Files.exists(tempDir.resolve("b/copy.json")));
        assertEquals("A", store.read(tempDir.resolve("c.json")).orElseThrow().rhythmic().pattern());

        assertFalse(Files.exists(tempDir.resolve("empty.json")));
        assertFalse(Files.exists(tempDir.resolve("broken.json")));
    }

    @Test
    void testPiecesSharingABasenameDoNotOverwriteEachOther() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("same-name"));
        MidiTestFiles.write(dir.resolve("song.mid"), MidiTestFiles.quarters(96, 2, 60));
        MidiTestFiles.write(dir.resolve("song.midi"), MidiTestFiles.quarters(96, 3, 62));

        BatchResult result;
        try (BatchAnalyzer batch = new BatchAnalyzer(BatchOptions.defaultOptions().withThreads(2))) {
            result = batch.run(dir);
        }

        assertEquals(2, result.count(PieceResult.Status.ANALYZED));
        assertEquals("AAA", result.pieces().get(1).analysis().rhythmicForm().render());
        PhrasalMeta meta = new PieceMetaStore().read(dir.resolve("song.json")).orElseThrow();
        assertEquals("AA", meta.rhythmic().pattern(), "the first piece in scan order owns the side-file");
        try (Stream<Path> listing = Files.list(dir)) {
            assertEquals(1, listing.filter(p -> p.toString().endsWith(".json")).count());
        }
    }

    @Test
    void testDuplicatesShareOneAnalysisButKeepTheirOwnSource() throws IOException {
        BatchResult result;
        try (BatchAnalyzer batch = new BatchAnalyzer(BatchOptions.defaultOptions().withThreads(4).withWriteMetadata(false))) {
            result = batch.run(tempDir);
        }
        PieceResult original = result.pieces().get(0);
        PieceResult copy = result.pieces().get(1);

        assertSame(original.analysis(), copy.analysis());
        assertEquals("a.mid", original.piece().orElseThrow().source());
        assertEquals("b/copy.mid", copy.piece().orElseThrow().source());
        assertEquals(original.piece().orElseThrow().events(), copy.piece().orElseThrow().events());
    }

    @Test
    void testNoMetadataLeavesTreeUntouched() throws IOException {
        try (BatchAnalyzer batch = new BatchAnalyzer(BatchOptions.defaultOptions().withWriteMetadata(false))) {
            batch.run(tempDir);
        }
        assertFalse(Files.exists(tempDir.resolve("a.json")));
        assertFalse(Files.exists(tempDir.resolve("c.json")));
    }

    @Test
    void testMissingDirectory() {
        try (BatchAnalyzer batch = new BatchAnalyzer(BatchOptions.defaultOptions())) {
            assertThrows(IOException.class, () -> batch.run(tempDir.resolve("nope")));
        }
    }

    @Test
    void testOptionsValidation() {
        assertThrows(IllegalArgumentException.class, () -> BatchOptions.defaultOptions().withThreads(0));
        assertThrows(IllegalArgumentException.class, () -> BatchOptions.defaultOptions().withTrackIndex(-1));
        assertTrue(BatchOptions.defaultOptions().writeMetadata());
    }
}
