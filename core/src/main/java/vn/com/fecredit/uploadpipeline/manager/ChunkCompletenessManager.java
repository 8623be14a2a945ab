package vn.com.fecredit.uploadpipeline.manager;

import lombok.Getter;
import vn.com.fecredit.uploadpipeline.model.ChunkStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;
import vn.com.fecredit.uploadpipeline.model.util.BitsetUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Evaluates whether the completed chunks of a session form a contiguous set
 * {@code 1..chunksCount}.
 *
 * <p>
 * The evaluation marks every completed chunk in a bitset:
 * <ul>
 * <li>Each bit represents one chunk (1 = received, 0 = missing)</li>
 * <li>Chunk numbers outside {@code 1..chunksCount} are reported as out of range</li>
 * <li>A number marked twice is reported as a duplicate</li>
 * </ul>
 * A session is complete only when the bitset is full and there are neither
 * duplicates nor out-of-range numbers.
 */
public final class ChunkCompletenessManager {

    private ChunkCompletenessManager() {
    }

    public static Completeness evaluate(int chunksCount, Collection<? extends IChunk> chunks) {
        byte[] bitset = BitsetUtil.newBitset(chunksCount);
        List<Integer> duplicates = new ArrayList<>();
        List<Integer> outOfRange = new ArrayList<>();
        int completed = 0;
        long uploadedSize = 0;
        for (IChunk chunk : chunks) {
            if (chunk.getStatus() != ChunkStatus.COMPLETED) {
                continue;
            }
            int number = chunk.getChunkNumber();
            if (number < 1 || number > chunksCount) {
                outOfRange.add(number);
                continue;
            }
            if (BitsetUtil.markChunk(bitset, number)) {
                duplicates.add(number);
                continue;
            }
            completed++;
            uploadedSize += chunk.getSize();
        }
        List<Integer> missing = BitsetUtil.missingChunks(bitset, chunksCount);
        return new Completeness(chunksCount, completed, uploadedSize, missing, duplicates, outOfRange);
    }

    @Getter
    public static final class Completeness {
        private final int chunksCount;
        private final int completedChunks;
        private final long uploadedSize;
        private final List<Integer> missingChunks;
        private final List<Integer> duplicateChunks;
        private final List<Integer> outOfRangeChunks;

        Completeness(int chunksCount, int completedChunks, long uploadedSize, List<Integer> missingChunks,
                     List<Integer> duplicateChunks, List<Integer> outOfRangeChunks) {
            this.chunksCount = chunksCount;
            this.completedChunks = completedChunks;
            this.uploadedSize = uploadedSize;
            this.missingChunks = List.copyOf(missingChunks);
            this.duplicateChunks = List.copyOf(duplicateChunks);
            this.outOfRangeChunks = List.copyOf(outOfRangeChunks);
        }

        public boolean isComplete() {
            return chunksCount > 0 && missingChunks.isEmpty()
                    && duplicateChunks.isEmpty() && outOfRangeChunks.isEmpty();
        }

        /**
         * {@code completed / chunksCount * 100}, rounded to two decimals.
         */
        public double getProgressPercentage() {
            if (chunksCount <= 0) {
                return 0.0;
            }
            return Math.round(completedChunks * 10000.0 / chunksCount) / 100.0;
        }
    }
}
