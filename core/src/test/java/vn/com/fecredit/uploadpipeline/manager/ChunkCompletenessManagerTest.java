package vn.com.fecredit.uploadpipeline.manager;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.uploadpipeline.model.ChunkStatus;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultChunk;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkCompletenessManagerTest {

    private static DefaultChunk chunk(int number, ChunkStatus status) {
        DefaultChunk chunk = new DefaultChunk();
        chunk.setSessionId("s1");
        chunk.setChunkNumber(number);
        chunk.setSize(100);
        chunk.setStatus(status);
        return chunk;
    }

    private static List<DefaultChunk> completed(int... numbers) {
        List<DefaultChunk> chunks = new ArrayList<>();
        for (int number : numbers) {
            chunks.add(chunk(number, ChunkStatus.COMPLETED));
        }
        return chunks;
    }

    @Test
    void testAllChunksPresent_isComplete() {
        ChunkCompletenessManager.Completeness result = ChunkCompletenessManager.evaluate(4, completed(3, 1, 4, 2));

        assertTrue(result.isComplete());
        assertEquals(4, result.getCompletedChunks());
        assertEquals(400, result.getUploadedSize());
        assertEquals(100.0, result.getProgressPercentage());
    }

    @Test
    void testMissingChunk_isIncomplete() {
        ChunkCompletenessManager.Completeness result = ChunkCompletenessManager.evaluate(3, completed(1, 3));

        assertFalse(result.isComplete());
        assertEquals(List.of(2), result.getMissingChunks());
        assertEquals(66.67, result.getProgressPercentage());
    }

    @Test
    void testDuplicateChunkNumber_isIncomplete() {
        ChunkCompletenessManager.Completeness result = ChunkCompletenessManager.evaluate(3, completed(1, 2, 2, 3));

        assertFalse(result.isComplete());
        assertEquals(List.of(2), result.getDuplicateChunks());
        assertEquals(3, result.getCompletedChunks());
    }

    @Test
    void testExtraChunkNumber_isIncomplete() {
        ChunkCompletenessManager.Completeness result = ChunkCompletenessManager.evaluate(3, completed(1, 2, 3, 4));

        assertFalse(result.isComplete());
        assertEquals(List.of(4), result.getOutOfRangeChunks());
        assertTrue(result.getMissingChunks().isEmpty());
    }

    @Test
    void testPendingAndFailedChunks_doNotCount() {
        List<DefaultChunk> chunks = completed(1);
        chunks.add(chunk(2, ChunkStatus.PENDING));
        chunks.add(chunk(3, ChunkStatus.FAILED));

        ChunkCompletenessManager.Completeness result = ChunkCompletenessManager.evaluate(3, chunks);

        assertFalse(result.isComplete());
        assertEquals(List.of(2, 3), result.getMissingChunks());
        assertEquals(33.33, result.getProgressPercentage());
    }

    @Test
    void testNoChunks() {
        ChunkCompletenessManager.Completeness result = ChunkCompletenessManager.evaluate(2, List.of());

        assertFalse(result.isComplete());
        assertEquals(0.0, result.getProgressPercentage());
        assertEquals(List.of(1, 2), result.getMissingChunks());
    }
}
