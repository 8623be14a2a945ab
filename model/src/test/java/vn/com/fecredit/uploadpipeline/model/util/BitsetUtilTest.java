package vn.com.fecredit.uploadpipeline.model.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BitsetUtilTest {

    /**
     * 5 chunks in a single byte: 5 lower bits available, 3 upper bits pre-set (0xE0).
     */
    @Test
    void testNewBitset_5Chunks_1Byte() {
        byte[] bitset = BitsetUtil.newBitset(5);
        assertEquals(1, bitset.length);
        assertEquals((byte) 0xE0, bitset[0]);
    }

    @Test
    void testNewBitset_8Chunks_1Byte() {
        byte[] bitset = BitsetUtil.newBitset(8);
        assertEquals((byte) 0x00, bitset[0]);
    }

    @Test
    void testNewBitset_10Chunks_2Bytes() {
        byte[] bitset = BitsetUtil.newBitset(10);
        assertEquals((byte) 0x00, bitset[0]);
        assertEquals((byte) 0xFC, bitset[1]);
    }

    @Test
    void testMarkChunk_isOneBased() {
        byte[] bitset = BitsetUtil.newBitset(10);
        BitsetUtil.markChunk(bitset, 1);
        BitsetUtil.markChunk(bitset, 2);
        BitsetUtil.markChunk(bitset, 9);
        BitsetUtil.markChunk(bitset, 10);
        assertEquals((byte) 0x03, bitset[0], "First byte should have bits 0 and 1 set");
        assertEquals(0xFF03, ((bitset[1] & 0xFF) << 8) | (bitset[0] & 0xFF), "Combined bits check");
    }

    @Test
    void testMarkChunk_reportsRepeatedChunk() {
        byte[] bitset = BitsetUtil.newBitset(3);
        assertFalse(BitsetUtil.markChunk(bitset, 2));
        assertTrue(BitsetUtil.markChunk(bitset, 2));
    }

    @Test
    void testMissingChunks() {
        byte[] bitset = BitsetUtil.newBitset(12);
        BitsetUtil.markChunk(bitset, 1);
        BitsetUtil.markChunk(bitset, 3);
        BitsetUtil.markChunk(bitset, 9);
        assertEquals(List.of(2, 4, 5, 6, 7, 8, 10, 11, 12), BitsetUtil.missingChunks(bitset, 12));
    }

    @Test
    void testMarkChunk_outOfRangeIsIgnored() {
        byte[] bitset = BitsetUtil.newBitset(4);
        BitsetUtil.markChunk(bitset, 0);
        BitsetUtil.markChunk(bitset, 40);
        assertEquals(List.of(1, 2, 3, 4), BitsetUtil.missingChunks(bitset, 4));
    }
}
