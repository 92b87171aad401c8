/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli.batch;

/**
 * Settings of one batch run.
 */
public record BatchOptions(
        int threads,            // worker threads analyzing pieces in parallel
        int trackIndex,         // MIDI track to read from each file
        boolean writeMetadata,  // write the per-piece JSON side-file
        long cacheSize          // analyses kept for files with identical content
) {
    public static final int DEFAULT_THREADS = Integer.getInteger("phrasal.batch.threads",
            Runtime.getRuntime().availableProcessors());
    public static final long DEFAULT_CACHE_SIZE = Long.getLong("phrasal.analysis.cacheSize", 256L);

    public BatchOptions {
        if (threads < 1) throw new IllegalArgumentException("threads must be at least 1: " + threads);
        if (trackIndex < 0) throw new IllegalArgumentException("negative track index: " + trackIndex);
        if (cacheSize < 0) throw new IllegalArgumentException("negative cache size: " + cacheSize);
    }

    public static BatchOptions defaultOptions() {
        return new BatchOptions(Math.max(1, DEFAULT_THREADS), 0, true, DEFAULT_CACHE_SIZE);
    }

    public BatchOptions withThreads(int threads) {
        return new BatchOptions(threads, trackIndex, writeMetadata, cacheSize);
    }

    public BatchOptions withTrackIndex(int trackIndex) {
        return new BatchOptions(threads, trackIndex, writeMetadata, cacheSize);
    }

    public BatchOptions withWriteMetadata(boolean writeMetadata) {
        return new BatchOptions(threads, trackIndex, writeMetadata, cacheSize);
    }
}
