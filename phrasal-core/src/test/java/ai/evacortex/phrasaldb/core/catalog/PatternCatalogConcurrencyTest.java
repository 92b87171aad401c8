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
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.*;
import java.util.stream.IntStream;

@TestInstance(TestInstance.Lifecycle.PER_METHOD)
class PatternCatalogConcurrencyTest {

    private static final int THREADS         = 8;
    private static final int PIECES_PER_TASK = 50;
    private static final int MEASURES        = 16;

    @Test @Timeout(60)
    void concurrentMergesMatchSequentialBuild() throws Exception {
        List<List<RhythmFingerprint>> pieces = new ArrayList<>();
        Random random = new Random(7);
        for (int p = 0; p < THREADS * PIECES_PER_TASK; p++) {
            List<RhythmFingerprint> measures = new ArrayList<>();
            for (int m = 0; m < MEASURES; m++) {
                measures.add(RhythmFingerprint.fromMask(random.nextInt(8) * 0x1111));
            }
            pieces.add(measures);
        }

        PatternCatalog sequential = new PatternCatalog();
        for (int p = 0; p < pieces.size(); p++) {
            sequential.contribute("piece-" + p, pieces.get(p));
        }

        PatternCatalog shared = new PatternCatalog();
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        IntStream.range(0, THREADS).forEach(t -> futures.add(pool.submit(() -> {
            start.await();
            for (int i = 0; i < PIECES_PER_TASK; i++) {
                int p = t * PIECES_PER_TASK + i;
                if (p % 2 == 0) {
                    shared.merge(PatternCatalog.ofPiece("piece-" + p, pieces.get(p)));
                } else {
                    shared.contribute("piece-" + p, pieces.get(p));
                }
            }
            return null;
        })));

        start.countDown();
        for (Future<?> f : futures) f.get();
        pool.shutdown();
        Assertions.assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        Assertions.assertEquals(sequential.snapshot(), shared.snapshot());
        Assertions.assertEquals(sequential.ranked(), shared.ranked());
        Assertions.assertEquals((long) pieces.size() * MEASURES, shared.totalOccurrences());
    }
}
