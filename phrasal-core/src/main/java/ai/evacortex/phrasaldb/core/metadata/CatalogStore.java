/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.metadata;

import ai.evacortex.phrasaldb.core.catalog.CatalogEntry;
import ai.evacortex.phrasaldb.core.catalog.PatternCatalog;
import ai.evacortex.phrasaldb.core.exceptions.MetadataPersistenceException;
import ai.evacortex.phrasaldb.core.fingerprint.RhythmFingerprint;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.*;

/**
 * JSON export of a pattern catalog in ranking order. The export can be loaded back
 * and merged into another catalog, which lets separate runs be combined.
 */
public class CatalogStore {

    public record Row(int rank, int[] positions, String grid, long occurrences, int support, List<String> pieces) {}

    /** {@code pieces} lists every contributing piece, including pieces without measures. */
    public record Document(int pieceCount, int patternCount, long measureCount, List<String> pieces, List<Row> patterns) {}

    private final ObjectMapper mapper;

    public CatalogStore() {
        this(new ObjectMapper());
    }

    public CatalogStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static Document toDocument(PatternCatalog catalog) {
        List<CatalogEntry> ranked = catalog.ranked();
        List<Row> rows = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            CatalogEntry entry = ranked.get(i);
            rows.add(new Row(i + 1,
                    entry.fingerprint().positions(),
                    entry.fingerprint().toGrid(),
                    entry.occurrences(),
                    entry.supportCount(),
                    new ArrayList<>(entry.support())));
        }
        List<String> pieces = new ArrayList<>(catalog.pieceIds());
        return new Document(pieces.size(), catalog.size(), catalog.totalOccurrences(), pieces, rows);
    }

    public void save(Path file, PatternCatalog catalog) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(file,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, toDocument(catalog));
            }
        } catch (IOException e) {
            throw new MetadataPersistenceException(file.toString(), e);
        }
    }

    /** Rebuilds a catalog from a saved export; a missing file yields an empty catalog. */
    public PatternCatalog loadOrCreate(Path file) {
        PatternCatalog catalog = new PatternCatalog();
        if (!Files.exists(file)) {
            return catalog;
        }
        Document document;
        try (InputStream in = Files.newInputStream(file)) {
            document = mapper.readValue(in, Document.class);
        } catch (IOException e) {
            throw new MetadataPersistenceException(file.toString(), e);
        }
        for (Row row : document.patterns()) {
            RhythmFingerprint fingerprint = RhythmFingerprint.of(row.positions());
            Map<String, List<RhythmFingerprint>> perPiece = spread(file, fingerprint, row);
            perPiece.forEach(catalog::contribute);
        }
        if (document.pieces() != null) {
            document.pieces().forEach(piece -> catalog.contribute(piece, List.of()));
        }
        return catalog;
    }

    /**
     * Re-expresses a row as per-piece contributions: each supporting piece gets one
     * occurrence, and the remainder goes to the first piece.
     */
    private static Map<String, List<RhythmFingerprint>> spread(Path file, RhythmFingerprint fingerprint, Row row) {
        if (row.pieces().isEmpty() || row.occurrences() < row.pieces().size()) {
            throw new MetadataPersistenceException(file.toString(), new IOException("pattern " + fingerprint
                    + " has " + row.occurrences() + " occurrences for " + row.pieces().size() + " pieces"));
        }
        Map<String, List<RhythmFingerprint>> perPiece = new LinkedHashMap<>();
        long remainder = row.occurrences() - row.pieces().size();
        for (String piece : row.pieces()) {
            List<RhythmFingerprint> measures = new ArrayList<>();
            measures.add(fingerprint);
            perPiece.put(piece, measures);
        }
        List<RhythmFingerprint> first = perPiece.get(row.pieces().get(0));
        for (long i = 0; i < remainder; i++) {
            first.add(fingerprint);
        }
        return perPiece;
    }
}
