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
import ai.evacortex.phrasaldb.cli.midi.MidiDecodeException;
import ai.evacortex.phrasaldb.cli.midi.MidiNoteDecoder;
import ai.evacortex.phrasaldb.cli.scan.MidiFileScanner;
import ai.evacortex.phrasaldb.core.analysis.PhraseAnalyzer;
import ai.evacortex.phrasaldb.core.analysis.PieceAnalysis;
import ai.evacortex.phrasaldb.core.catalog.PatternCatalog;
import ai.evacortex.phrasaldb.core.exceptions.MetadataPersistenceException;
import ai.evacortex.phrasaldb.core.metadata.PieceMetaStore;
import ai.evacortex.phrasaldb.core.util.HashingUtil;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Analyzes many MIDI files and folds them into one {@link PatternCatalog}.
 *
 * <p>Each file is decoded and analyzed on a worker thread into its own partial
 * catalog. Partials are merged afterwards in scan order, one at a time. A file
 * that cannot be read or decoded is reported as failed and does not stop the
 * batch. Files with identical bytes share one cached analysis but still count as
 * separate pieces. When two files map to the same side-file ({@code song.mid} and
 * {@code song.midi}), only the first in scan order writes it.</p>
 */
public class BatchAnalyzer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final BatchOptions options;
    private final MidiNoteDecoder decoder;
    private final PhraseAnalyzer analyzer;
    private final PieceMetaStore metaStore;
    private final Cache<Long, CachedPiece> cache;
    private final ExecutorService executor;

    private record CachedPiece(DecodedPiece piece, PieceAnalysis analysis) {}

    private record Outcome(PieceResult result, PatternCatalog partial) {}

    public BatchAnalyzer(BatchOptions options) {
        this(options, new PieceMetaStore());
    }

    public BatchAnalyzer(BatchOptions options, PieceMetaStore metaStore) {
        this.options = options;
        this.decoder = new MidiNoteDecoder(options.trackIndex());
        this.analyzer = new PhraseAnalyzer();
        this.metaStore = metaStore;
        this.cache = Caffeine.newBuilder()
                .maximumSize(options.cacheSize())
                .build();
        this.executor = Executors.newFixedThreadPool(options.threads(), r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("phrasal-batch");
            return t;
        });
    }

    public BatchResult run(Path root) throws IOException {
        return run(root, MidiFileScanner.scan(root));
    }

    public BatchResult run(Path root, List<Path> files) {
        Map<Path, String> sideFileOwners = new HashMap<>();
        List<Future<Outcome>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            String pieceId = MidiFileScanner.pieceId(root, file);
            boolean ownsSideFile = claimSideFile(sideFileOwners, file, pieceId);
            futures.add(executor.submit(() -> process(file, pieceId, ownsSideFile)));
        }

        List<PieceResult> results = new ArrayList<>(files.size());
        PatternCatalog catalog = new PatternCatalog();
        for (int i = 0; i < futures.size(); i++) {
            Outcome outcome = await(futures.get(i), files.get(i), MidiFileScanner.pieceId(root, files.get(i)));
            results.add(outcome.result());
            if (outcome.partial() != null) {
                catalog.merge(outcome.partial());
            }
        }
        log.info("Analyzed {} file(s): {} with measures, {} empty, {} failed",
                results.size(),
                results.stream().filter(r -> r.status() == PieceResult.Status.ANALYZED).count(),
                results.stream().filter(r -> r.status() == PieceResult.Status.EMPTY).count(),
                results.stream().filter(r -> r.status() == PieceResult.Status.FAILED).count());
        return new BatchResult(results, catalog);
    }

    private boolean claimSideFile(Map<Path, String> owners, Path file, String pieceId) {
        if (!options.writeMetadata()) {
            return false;
        }
        Path sideFile = PieceMetaStore.sideFileFor(file).toAbsolutePath().normalize();
        String owner = owners.putIfAbsent(sideFile, pieceId);
        if (owner != null) {
            log.warn("{} shares side-file {} with {}, metadata not written", pieceId, sideFile.getFileName(), owner);
            return false;
        }
        return true;
    }

    private Outcome process(Path file, String pieceId, boolean writeMetadata) {
        CachedPiece cached;
        try {
            byte[] data = Files.readAllBytes(file);
            cached = cache.get(HashingUtil.contentHash(data), key -> decodeAndAnalyze(pieceId, data));
        } catch (IOException e) {
            log.warn("Skipping {}: {}", pieceId, e.getMessage());
            return new Outcome(PieceResult.failed(file, pieceId, e.getMessage()), null);
        } catch (DecodeFailure e) {
            log.warn("Skipping {}: {}", pieceId, e.getCause().getMessage());
            return new Outcome(PieceResult.failed(file, pieceId, e.getCause().getMessage()), null);
        }
        DecodedPiece piece = cached.piece().source().equals(pieceId)
                ? cached.piece()
                : cached.piece().withSource(pieceId);
        if (piece != cached.piece()) {
            log.debug("{} has the same content as {}, reusing its analysis", pieceId, cached.piece().source());
        }

        PieceAnalysis analysis = cached.analysis();
        if (writeMetadata && !analysis.isEmpty()) {
            try {
                Path sideFile = metaStore.write(file, analysis);
                log.debug("Wrote {}", sideFile);
            } catch (MetadataPersistenceException e) {
                log.warn("{}", e.getMessage(), e);
            }
        }
        PatternCatalog partial = PatternCatalog.ofPiece(pieceId, analysis.rhythmFingerprints());
        return new Outcome(PieceResult.analyzed(file, pieceId, piece, analysis), partial);
    }

    /** Runs inside the cache's atomic load, so identical files are decoded once. */
    private CachedPiece decodeAndAnalyze(String pieceId, byte[] data) {
        try {
            DecodedPiece piece = decoder.decode(pieceId, data);
            return new CachedPiece(piece, analyzer.analyze(piece.events(), piece.ppqn()));
        } catch (MidiDecodeException e) {
            throw new DecodeFailure(e);
        }
    }

    /** Carries a {@link MidiDecodeException} out of the cache loader; failed loads are not cached. */
    private static final class DecodeFailure extends RuntimeException {
        DecodeFailure(MidiDecodeException cause) {
            super(cause);
        }
    }

    private static Outcome await(Future<Outcome> future, Path file, String pieceId) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while analyzing " + pieceId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.warn("Analysis of {} failed", pieceId, cause);
            return new Outcome(PieceResult.failed(file, pieceId, String.valueOf(cause)), null);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
