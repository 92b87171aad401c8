/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.util;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Supplier;

/**
 * Try-with-resources handle for one side of a {@link ReadWriteLock}, plus
 * shorthands for guarding a single query or update.
 */
public final class AutoLock implements AutoCloseable {
    private final Lock held;

    private AutoLock(Lock held) {
        held.lock();
        this.held = held;
    }

    public static AutoLock read(ReadWriteLock rw) {
        return new AutoLock(rw.readLock());
    }

    public static AutoLock write(ReadWriteLock rw) {
        return new AutoLock(rw.writeLock());
    }

    public static <T> T reading(ReadWriteLock rw, Supplier<T> query) {
        try (AutoLock ignored = read(rw)) {
            return query.get();
        }
    }

    public static void writing(ReadWriteLock rw, Runnable update) {
        try (AutoLock ignored = write(rw)) {
            update.run();
        }
    }

    @Override
    public void close() {
        held.unlock();
    }
}
