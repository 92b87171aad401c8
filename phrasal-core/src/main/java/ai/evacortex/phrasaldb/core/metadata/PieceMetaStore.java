/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.metadata;

import ai.evacortex.phrasaldb.core.analysis.PieceAnalysis;
import ai.evacortex.phrasaldb.core.exceptions.MetadataPersistenceException;
import ai.evacortex.phrasaldb.core.util.AutoLock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reads and writes the JSON side-file kept next to each analyzed piece.
 *
 * <p>The side-file may carry other top-level keys written by other tools. Those
 * are preserved; only the {@code "phrasal"} key is replaced.</p>
 */
public class PieceMetaStore {

    public static final String PHRASAL_KEY = "phrasal";
    public static final String SIDE_FILE_EXTENSION = ".json";

    private final ObjectMapper mapper;
    private final ConcurrentMap<Path, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public PieceMetaStore() {
        this(new ObjectMapper());
    }

    public PieceMetaStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * {@code song.mid} maps to {@code song.json} in the same directory, so
     * {@code song.mid} and {@code song.midi} share one side-file.
     */
    public static Path sideFileFor(Path piece) {
        String name = piece.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return piece.resolveSibling(base + SIDE_FILE_EXTENSION);
    }

    public Path write(Path piece, PieceAnalysis analysis) {
        Path sideFile = sideFileFor(piece);
        put(sideFile, PhrasalMeta.of(analysis));
        return sideFile;
    }

    /** Replaces the {@code "phrasal"} block; updates of one side-file through this store never interleave. */
    public void put(Path sideFile, PhrasalMeta meta) {
        try (AutoLock ignored = AutoLock.write(lockFor(sideFile))) {
            ObjectNode root = loadOrCreate(sideFile);
            root.set(PHRASAL_KEY, mapper.valueToTree(meta));
            Path parent = sideFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(sideFile,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, root);
            }
        } catch (IOException e) {
            throw new MetadataPersistenceException(sideFile.toString(), e);
        }
    }

    public Optional<PhrasalMeta> read(Path sideFile) {
        JsonNode phrasal;
        try (AutoLock ignored = AutoLock.read(lockFor(sideFile))) {
            if (!Files.exists(sideFile)) return Optional.empty();
            phrasal = loadOrCreate(sideFile).get(PHRASAL_KEY);
        }
        if (phrasal == null || phrasal.isNull()) return Optional.empty();
        try {
            return Optional.of(mapper.treeToValue(phrasal, PhrasalMeta.class));
        } catch (IOException e) {
            throw new MetadataPersistenceException(sideFile.toString(), e);
        }
    }

    private ReadWriteLock lockFor(Path sideFile) {
        return locks.computeIfAbsent(sideFile.toAbsolutePath().normalize(), p -> new ReentrantReadWriteLock());
    }

    private ObjectNode loadOrCreate(Path sideFile) {
        if (!Files.exists(sideFile)) {
            return mapper.createObjectNode();
        }
        try (InputStream in = Files.newInputStream(sideFile)) {
            JsonNode node = mapper.readTree(in);
            if (node instanceof ObjectNode object) {
                return object;
            }
            return mapper.createObjectNode();
        } catch (IOException e) {
            throw new MetadataPersistenceException(sideFile.toString(), e);
        }
    }
}
