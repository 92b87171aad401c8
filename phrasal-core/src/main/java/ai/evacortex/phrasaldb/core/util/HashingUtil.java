/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.util;

import net.jpountz.xxhash.XXHashFactory;

import java.util.HexFormat;

public class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;

    private HashingUtil() {}

    /** 64-bit content key of a file's bytes. */
    public static long contentHash(byte[] bytes) {
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static String contentHashHex(byte[] bytes) {
        return HexFormat.of().toHexDigits(contentHash(bytes));
    }
}
