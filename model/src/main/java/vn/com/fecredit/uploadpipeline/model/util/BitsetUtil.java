package vn.com.fecredit.uploadpipeline.model.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for tracking received chunks of an upload session in a bitset.
 *
 * <p>
 * Chunk numbers are 1-based; chunk {@code n} is stored in bit {@code n - 1}.
 * Bits past the last chunk are pre-set to 1 so that a full bitset means every
 * chunk has been received.
 */
public final class BitsetUtil {

    private BitsetUtil() {
    }

    /**
     * Allocates a bitset for the given number of chunks with the trailing unused bits set.
     */
    public static byte[] newBitset(int totalChunks) {
        if (totalChunks < 0) {
            throw new IllegalArgumentException("totalChunks must not be negative: " + totalChunks);
        }
        byte[] bitset = new byte[(totalChunks + 7) / 8];
        setUnusedBits(bitset, totalChunks);
        return bitset;
    }

    /**
     * Sets unused bits in the given bitset array to 1.
     * Bits within the range of totalChunks are not modified.
     */
    public static void setUnusedBits(byte[] bitset, int totalChunks) {
        if (bitset == null) return;
        for (int i = totalChunks; i < bitset.length * 8; i++) {
            setUsedBit(bitset, i);
        }
    }

    /**
     * Sets a specific bit to 1 in the bitset to mark it as used.
     */
    public static void setUsedBit(byte[] bitset, int bitIndex) {
        if (bitset != null && bitIndex >= 0) {
            int byteIndex = bitIndex / 8;
            int bitPosition = bitIndex % 8;
            if (byteIndex < bitset.length) {
                bitset[byteIndex] |= (byte) (1 << bitPosition);
            }
        }
    }

    /**
     * Returns whether the bit at the given index is set.
     */
    public static boolean isUsedBit(byte[] bitset, int bitIndex) {
        if (bitset == null || bitIndex < 0 || bitIndex / 8 >= bitset.length) {
            return false;
        }
        return (bitset[bitIndex / 8] & (1 << (bitIndex % 8))) != 0;
    }

    /**
     * Marks a 1-based chunk number as received.
     *
     * @return {@code true} if the chunk was already marked before this call
     */
    public static boolean markChunk(byte[] bitset, int chunkNumber) {
        boolean alreadySet = isUsedBit(bitset, chunkNumber - 1);
        setUsedBit(bitset, chunkNumber - 1);
        return alreadySet;
    }

    /**
     * Lists the 1-based chunk numbers in {@code 1..totalChunks} whose bit is not set.
     */
    public static List<Integer> missingChunks(byte[] bitset, int totalChunks) {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < totalChunks; i++) {
            if (!isUsedBit(bitset, i)) {
                missing.add(i + 1);
            }
        }
        return missing;
    }
}
