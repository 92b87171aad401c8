/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core;

import ai.evacortex.phrasaldb.core.util.HashingUtil;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HashingUtilTest {

    @Test
    void testContentHash_isDeterministicAndContentSensitive() {
        byte[] piece1 = "MThd piece".getBytes(StandardCharsets.US_ASCII);
        byte[] piece2 = "MThd piece".getBytes(StandardCharsets.US_ASCII);
        byte[] other = "MThd other".getBytes(StandardCharsets.US_ASCII);

        assertEquals(HashingUtil.contentHash(piece1), HashingUtil.contentHash(piece2),
                "Content hash must be deterministic for identical bytes");
        assertNotEquals(HashingUtil.contentHash(piece1), HashingUtil.contentHash(other),
                "Hashes must differ for different bytes");

        String hex = HashingUtil.contentHashHex(piece1);
        assertEquals(16, hex.length(), "64-bit hex string must be 16 chars long");
        assertEquals(HashingUtil.contentHash(piece1), Long.parseUnsignedLong(hex, 16));
    }
}
