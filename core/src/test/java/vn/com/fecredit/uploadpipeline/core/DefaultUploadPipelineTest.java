package vn.com.fecredit.uploadpipeline.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.uploadpipeline.exception.ChecksumMismatchException;
import vn.com.fecredit.uploadpipeline.exception.ChunkStorageException;
import vn.com.fecredit.uploadpipeline.exception.DuplicateUploadException;
import vn.com.fecredit.uploadpipeline.exception.IncompleteUploadException;
import vn.com.fecredit.uploadpipeline.exception.InvalidSessionStateException;
import vn.com.fecredit.uploadpipeline.exception.InvalidTransitionException;
import vn.com.fecredit.uploadpipeline.exception.ScanTimeoutException;
import vn.com.fecredit.uploadpipeline.exception.ScannerUnavailableException;
import vn.com.fecredit.uploadpipeline.model.ChunkReceipt;
import vn.com.fecredit.uploadpipeline.model.ChunkStatus;
import vn.com.fecredit.uploadpipeline.model.CreateSessionRequest;
import vn.com.fecredit.uploadpipeline.model.ScanResult;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.SessionStatusResponse;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultAsset;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultChunk;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultUploadSession;
import vn.com.fecredit.uploadpipeline.model.util.ChecksumUtil;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultAssetPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultChunkPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultSessionEventPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultSessionHistoryPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultUploadSessionPort;
import vn.com.fecredit.uploadpipeline.port.impl.LocalFileChunkStore;
import vn.com.fecredit.uploadpipeline.port.impl.LocalFileDurableStorage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DefaultUploadPipelineTest {

    private Path assemblyDir;
    private ScriptedVirusScanner scanner;
    private QueueingStageDispatcher dispatcher;
    private DefaultUploadPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        Path chunkDir = Files.createTempDirectory("chunks");
        Path assetDir = Files.createTempDirectory("assets");
        assemblyDir = Files.createTempDirectory("assembly");
        scanner = new ScriptedVirusScanner();
        dispatcher = new QueueingStageDispatcher();
        pipeline = new DefaultUploadPipeline(chunkDir.toString(), assetDir.toString(), scanner, dispatcher,
                new MutableClock(), PipelineSettings.builder().assemblyDir(assemblyDir).build());
    }

    private static CreateSessionRequest request(String filename, long totalSize, int chunksCount) {
        return new CreateSessionRequest(1L, 10L, 7L, filename, totalSize, chunksCount);
    }

    private static byte[] payload(String prefix, int size) {
        byte[] data = new byte[size];
        Arrays.fill(data, (byte) 'x');
        byte[] head = prefix.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(head, 0, data, 0, Math.min(head.length, size));
        return data;
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    private byte[] storedAsset(DefaultAsset asset) throws IOException {
        try (InputStream in = pipeline.getDurableStorage().open(asset.getStorageReference())) {
            return in.readAllBytes();
        }
    }

    private DefaultUploadSession session(String sessionId) {
        return pipeline.findSession(sessionId).orElseThrow();
    }

    private long assembledFiles() throws IOException {
        try (Stream<Path> files = Files.list(assemblyDir)) {
            return files.count();
        }
    }

    @Test
    void testEndToEnd_twoChunkWavBecomesOneAsset() throws IOException {
        String id = pipeline.createSession(request("track.wav", 2044, 2)).getSessionId();
        byte[] chunk1 = payload("chunk_1_data", 1022);
        byte[] chunk2 = payload("chunk_2_data", 1022);

        ChunkReceipt first = pipeline.uploadChunk(id, 1, chunk1, null);
        assertEquals(UploadStatus.UPLOADING, first.getSessionStatus());
        assertFalse(first.isAssemblyTriggered());

        ChunkReceipt second = pipeline.uploadChunk(id, 2, chunk2, null);
        assertTrue(second.isAssemblyTriggered());
        assertEquals(UploadStatus.ASSEMBLING, second.getSessionStatus());
        assertEquals(1, dispatcher.pending());

        assertTrue(dispatcher.runNext());
        DefaultUploadSession scanning = session(id);
        assertEquals(UploadStatus.VIRUS_SCANNING, scanning.getStatus());
        Path assembled = Paths.get(scanning.getAssembledFilePath());
        byte[] assembledBytes = Files.readAllBytes(assembled);
        assertEquals(2044, assembledBytes.length);
        assertEquals("chunk_1_data", new String(assembledBytes, 0, 12, StandardCharsets.US_ASCII));
        assertEquals("chunk_2_data", new String(assembledBytes, 1022, 12, StandardCharsets.US_ASCII));
        assertArrayEquals(concat(chunk1, chunk2), assembledBytes);
        assertTrue(assembled.getFileName().toString().startsWith("assembled_" + id + "_"));
        assertTrue(assembled.getFileName().toString().endsWith(".wav"));

        assertTrue(dispatcher.runNext());
        assertEquals(UploadStatus.FINALIZING, session(id).getStatus());

        assertTrue(dispatcher.runNext());
        DefaultUploadSession completed = session(id);
        assertEquals(UploadStatus.COMPLETED, completed.getStatus());
        assertNull(completed.getActiveSlotKey());
        assertNotNull(completed.getCompletedAt());

        DefaultAsset asset = pipeline.findAsset(id).orElseThrow();
        assertEquals(2044, asset.getFileSize());
        assertEquals("audio/wav", asset.getContentType());
        assertEquals("track.wav", asset.getFilename());
        assertEquals(asset.getId(), completed.getAssetId());
        assertEquals(id, asset.getMetadata().get("upload_session_id"));
        assertEquals(2, asset.getMetadata().get("chunks_count"));
        assertArrayEquals(concat(chunk1, chunk2), storedAsset(asset));
        assertFalse(Files.exists(assembled));
        assertEquals(0, dispatcher.pending());

        SessionStatusResponse status = pipeline.getStatus(id);
        assertEquals("completed", status.getStatus());
        assertEquals(100.0, status.getProgressPercentage());
        assertNull(status.getErrorMessage());
        Map<?, ?> scan = (Map<?, ?>) status.getMetadata().get("virus_scan");
        assertEquals("clean", scan.get("status"));
        Map<?, ?> finalization = (Map<?, ?>) status.getMetadata().get("finalization");
        assertEquals(asset.getId(), finalization.get("asset_id"));
        assertEquals(2044L, finalization.get("file_size"));
    }

    @Test
    void testChunksUploadedOutOfOrder_areAssembledInSequenceOrder() throws IOException {
        int[] sizes = {700, 1, 333, 1024, 90};
        byte[][] chunks = new byte[sizes.length][];
        for (int i = 0; i < sizes.length; i++) {
            chunks[i] = payload("part-" + (i + 1) + "-", sizes[i]);
        }
        long total = Arrays.stream(sizes).sum();
        String id = pipeline.createSession(request("mix.bin", total, sizes.length)).getSessionId();

        for (int number : new int[]{3, 5, 1, 4, 2}) {
            pipeline.uploadChunk(id, number, chunks[number - 1], null);
        }
        dispatcher.runAll();

        DefaultAsset asset = pipeline.findAsset(id).orElseThrow();
        assertArrayEquals(concat(chunks), storedAsset(asset));
        assertEquals("application/octet-stream", asset.getContentType());
    }

    @Test
    void testConcurrentChunkUploads_dispatchAssemblyExactlyOnce() throws Exception {
        int count = 8;
        List<byte[]> chunks = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            chunks.add(payload("c" + i, 256));
        }
        String id = pipeline.createSession(request("parallel.bin", 256L * count, count)).getSessionId();

        ExecutorService pool = Executors.newFixedThreadPool(count);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ChunkReceipt>> results = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            int number = i;
            results.add(pool.submit(() -> {
                start.await();
                return pipeline.uploadChunk(id, number, chunks.get(number - 1), null);
            }));
        }
        start.countDown();
        int triggered = 0;
        for (Future<ChunkReceipt> result : results) {
            if (result.get().isAssemblyTriggered()) {
                triggered++;
            }
        }
        pool.shutdown();

        assertEquals(1, triggered);
        assertEquals(1, dispatcher.pending());
        dispatcher.runAll();
        assertArrayEquals(concat(chunks.toArray(new byte[0][])), storedAsset(pipeline.findAsset(id).orElseThrow()));
    }

    @Test
    void testSameChunkRetried_lastWriteWins() throws IOException {
        String id = pipeline.createSession(request("retry.txt", 8, 2)).getSessionId();
        pipeline.uploadChunk(id, 1, "AAAA".getBytes(StandardCharsets.US_ASCII), null);
        pipeline.uploadChunk(id, 1, "BBBB".getBytes(StandardCharsets.US_ASCII), null);
        pipeline.uploadChunk(id, 2, "CCCC".getBytes(StandardCharsets.US_ASCII), null);
        dispatcher.runAll();

        DefaultAsset asset = pipeline.findAsset(id).orElseThrow();
        assertEquals("BBBBCCCC", new String(storedAsset(asset), StandardCharsets.US_ASCII));
        assertEquals("text/plain", asset.getContentType());
    }

    private AbstractUploadPipeline<DefaultUploadSession, DefaultChunk, DefaultAsset> pipelineOver(
            LocalFileChunkStore store) throws IOException {
        DefaultSessionEventPort events = new DefaultSessionEventPort();
        return new AbstractUploadPipeline<DefaultUploadSession, DefaultChunk, DefaultAsset>(
                new DefaultUploadSessionPort(events), new DefaultChunkPort(), new DefaultAssetPort(), events,
                new DefaultSessionHistoryPort(), store, scanner,
                new LocalFileDurableStorage(Files.createTempDirectory("assets").toString()), dispatcher,
                new MutableClock(), PipelineSettings.builder().assemblyDir(assemblyDir).build()) {
            @Override
            protected DefaultUploadSession newSession() {
                return new DefaultUploadSession();
            }

            @Override
            protected DefaultChunk newChunk() {
                return new DefaultChunk();
            }

            @Override
            protected DefaultAsset newAsset() {
                return new DefaultAsset();
            }
        };
    }

    @Test
    void testChunkRetryRacingAssemblyTrigger_keepsChunkCompleted() throws Exception {
        BlockingChunkStore store = new BlockingChunkStore(Files.createTempDirectory("chunks").toString());
        AbstractUploadPipeline<DefaultUploadSession, DefaultChunk, DefaultAsset> racing = pipelineOver(store);
        byte[] chunk1 = payload("first", 10);
        byte[] chunk2 = payload("second", 10);
        String id = racing.createSession(request("race.bin", 20, 2)).getSessionId();
        racing.uploadChunk(id, 1, chunk1, null);

        store.armFor(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<ChunkReceipt> retry = pool.submit(() -> racing.uploadChunk(id, 1, chunk1, null));
        assertTrue(store.entered.await(5, TimeUnit.SECONDS));

        assertTrue(racing.uploadChunk(id, 2, chunk2, null).isAssemblyTriggered());
        store.release.countDown();
        ChunkReceipt retried = retry.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(UploadStatus.ASSEMBLING, retried.getSessionStatus());
        assertFalse(retried.isAssemblyTriggered());
        dispatcher.runAll();
        assertEquals(UploadStatus.COMPLETED, racing.findSession(id).orElseThrow().getStatus());
        DefaultAsset asset = racing.findAsset(id).orElseThrow();
        try (InputStream in = racing.getDurableStorage().open(asset.getStorageReference())) {
            assertArrayEquals(concat(chunk1, chunk2), in.readAllBytes());
        }
    }

    @Test
    void testFailedRetryOfStoredChunk_keepsChunkCompleted() throws IOException {
        BlockingChunkStore store = new BlockingChunkStore(Files.createTempDirectory("chunks").toString());
        AbstractUploadPipeline<DefaultUploadSession, DefaultChunk, DefaultAsset> flaky = pipelineOver(store);
        String id = flaky.createSession(request("flaky.bin", 20, 2)).getSessionId();
        flaky.uploadChunk(id, 1, payload("one", 10), null);

        store.failNext();
        assertThrows(ChunkStorageException.class, () -> flaky.uploadChunk(id, 1, payload("one", 10), null));
        assertEquals(ChunkStatus.COMPLETED, flaky.getChunkPort().findChunk(id, 1).orElseThrow().getStatus());

        assertTrue(flaky.uploadChunk(id, 2, payload("two", 10), null).isAssemblyTriggered());
        dispatcher.runAll();
        assertEquals(UploadStatus.COMPLETED, flaky.findSession(id).orElseThrow().getStatus());
    }

    @Test
    void testAssembledSizeMismatch_failsWithoutRetry() throws IOException {
        String id = pipeline.createSession(request("short.bin", 25, 2)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("one", 10), null);
        pipeline.uploadChunk(id, 2, payload("two", 10), null);
        dispatcher.runAll();

        assertEquals(UploadStatus.FAILED, session(id).getStatus());
        assertEquals(1, dispatcher.getAttempts());
        assertEquals(0, assembledFiles());
        assertTrue(pipeline.getStatus(id).getErrorMessage().contains("size mismatch: expected 25 bytes, got 20"));
        assertFalse(pipeline.findAsset(id).isPresent());
    }

    @Test
    void testExistingAssetAtLocation_failsAssembly() throws IOException {
        String id = pipeline.createSession(request("taken.txt", 10, 1)).getSessionId();
        DefaultAsset earlier = new DefaultAsset();
        earlier.setUploadSessionId("earlier-session");
        earlier.setWorkspaceId(1L);
        earlier.setContainerId(10L);
        earlier.setFilename("taken.txt");
        pipeline.getAssetPort().createAsset(earlier);

        pipeline.uploadChunk(id, 1, payload("dup", 10), null);
        dispatcher.runAll();

        assertEquals(UploadStatus.FAILED, session(id).getStatus());
        assertEquals(0, assembledFiles());
        assertTrue(pipeline.getStatus(id).getErrorMessage().contains("already exists in this location"));
        assertFalse(pipeline.findAsset(id).isPresent());
    }

    @Test
    void testDuplicateActiveUpload_isRejectedUntilSlotReleased() {
        DefaultUploadSession first = pipeline.createSession(request("song.mp3", 100, 1));

        assertThrows(DuplicateUploadException.class, () -> pipeline.createSession(request("song.mp3", 100, 1)));
        assertNotNull(pipeline.createSession(new CreateSessionRequest(1L, 11L, 7L, "song.mp3", 100, 1)));
        assertNotNull(pipeline.createSession(new CreateSessionRequest(1L, null, 7L, "song.mp3", 100, 1)));

        pipeline.cancel(first.getSessionId());
        assertNotNull(pipeline.createSession(request("song.mp3", 100, 1)));
    }

    @Test
    void testScannerUnavailable_completesWithSkippedScan() {
        scanner.setAvailable(false);
        String id = pipeline.createSession(request("offline.pdf", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("pdf", 10), null);
        dispatcher.runAll();

        assertEquals(UploadStatus.COMPLETED, session(id).getStatus());
        DefaultAsset asset = pipeline.findAsset(id).orElseThrow();
        assertEquals("application/pdf", asset.getContentType());
        Map<?, ?> scan = (Map<?, ?>) pipeline.getStatus(id).getMetadata().get("virus_scan");
        assertEquals("skipped", scan.get("status"));
        assertEquals("Scanner unavailable", scan.get("reason"));
        assertEquals("skipped", ((Map<?, ?>) asset.getMetadata().get("virus_scan")).get("status"));
        assertEquals(0, scanner.getScans());
    }

    @Test
    void testScannerBecomesUnavailableDuringScan_completesWithSkippedScan() {
        scanner.thenThrow(new ScannerUnavailableException("connection refused"));
        String id = pipeline.createSession(request("late.png", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("png", 10), null);
        dispatcher.runAll();

        assertEquals(UploadStatus.COMPLETED, session(id).getStatus());
        assertTrue(pipeline.findAsset(id).isPresent());
        Map<?, ?> scan = (Map<?, ?>) pipeline.getStatus(id).getMetadata().get("virus_scan");
        assertEquals("skipped", scan.get("status"));
        assertTrue(scan.get("reason").toString().contains("connection refused"));
    }

    @Test
    void testMissingChunk_neverAssemblesAndFailsWithoutAssembledFile() throws IOException {
        String id = pipeline.createSession(request("gap.bin", 30, 3)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("one", 10), null);
        pipeline.uploadChunk(id, 3, payload("three", 10), null);

        assertFalse(pipeline.canAssemble(id));
        IncompleteUploadException incomplete = assertThrows(IncompleteUploadException.class,
                () -> pipeline.completeUpload(id));
        assertEquals(List.of(2), incomplete.getMissingChunks());
        assertEquals(List.of(2), pipeline.getStatus(id).getMissingChunks());

        // force an assembly attempt regardless of the missing chunk
        assertTrue(pipeline.getStateMachine().transition(id, UploadStatus.UPLOADING, UploadStatus.ASSEMBLING,
                SessionEventType.TRANSITION, Map.of(), null));
        assertFalse(pipeline.canAssemble(id));
        assertTrue(pipeline.resume(id));
        dispatcher.runAll();

        assertEquals(UploadStatus.FAILED, session(id).getStatus());
        assertEquals(1, dispatcher.getAttempts());
        assertEquals(0, assembledFiles());
        assertTrue(pipeline.getStatus(id).getErrorMessage().contains("missing chunks [2]"));
        assertNull(session(id).getActiveSlotKey());
    }

    @Test
    void testInfectedFile_isNeverPromoted() throws IOException {
        scanner.thenReturn(ScanResult.infected("scripted", "Eicar-Test-Signature", Duration.ofMillis(3), 10));
        String id = pipeline.createSession(request("evil.txt", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("X5O!P%@AP", 10), null);
        dispatcher.runAll();

        DefaultUploadSession infected = session(id);
        assertEquals(UploadStatus.VIRUS_SCAN_FAILED, infected.getStatus());
        assertFalse(pipeline.findAsset(id).isPresent());
        assertFalse(Files.exists(Paths.get(infected.getAssembledFilePath())));

        SessionStatusResponse status = pipeline.getStatus(id);
        assertEquals("virus_scan_failed", status.getStatus());
        assertEquals("Virus detected: Eicar-Test-Signature", status.getErrorMessage());
        Map<?, ?> scan = (Map<?, ?>) status.getMetadata().get("virus_scan");
        assertEquals("infected", scan.get("status"));
        assertEquals("Eicar-Test-Signature", scan.get("virus_name"));

        assertNotNull(pipeline.createSession(request("evil.txt", 10, 1)));
    }

    @Test
    void testScanTimeout_isRetriedThenFails() {
        scanner.thenThrow(new ScanTimeoutException("t1"))
                .thenThrow(new ScanTimeoutException("t2"))
                .thenThrow(new ScanTimeoutException("t3"));
        String id = pipeline.createSession(request("slow.flac", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("flac", 10), null);
        dispatcher.runAll();

        assertEquals(3, scanner.getScans());
        assertEquals(UploadStatus.VIRUS_SCAN_FAILED, session(id).getStatus());
        SessionStatusResponse status = pipeline.getStatus(id);
        assertEquals("Virus scan failed: t3", status.getErrorMessage());
        Map<?, ?> scan = (Map<?, ?>) status.getMetadata().get("virus_scan");
        assertEquals("failed", scan.get("status"));
        assertEquals("scripted", scan.get("scanner"));
        assertFalse(pipeline.findAsset(id).isPresent());
    }

    @Test
    void testScanTimeout_recoversOnRetry() {
        scanner.thenThrow(new ScanTimeoutException("first attempt timed out"));
        String id = pipeline.createSession(request("retry.ogg", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("ogg", 10), null);
        dispatcher.runAll();

        assertEquals(2, scanner.getScans());
        assertEquals(UploadStatus.COMPLETED, session(id).getStatus());
        assertTrue(dispatcher.getFailures().isEmpty());
    }

    @Test
    void testAssembledFileGone_failsScanWithoutRetry() throws IOException {
        String id = pipeline.createSession(request("gone.m4a", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("m4a", 10), null);
        dispatcher.runNext();
        Files.delete(Paths.get(session(id).getAssembledFilePath()));

        dispatcher.runAll();

        assertEquals(1, scanner.getScans());
        assertEquals(UploadStatus.VIRUS_SCAN_FAILED, session(id).getStatus());
        assertTrue(pipeline.getStatus(id).getErrorMessage().contains("not found"));
    }

    @Test
    void testCancelWhileScanQueued_isNotOverwritten() {
        String id = pipeline.createSession(request("cancel.jpg", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("jpg", 10), null);
        dispatcher.runNext();

        assertEquals(UploadStatus.CANCELLED, pipeline.cancel(id).getStatus());
        dispatcher.runAll();

        assertEquals(UploadStatus.CANCELLED, session(id).getStatus());
        assertEquals(0, scanner.getScans());
        assertFalse(pipeline.findAsset(id).isPresent());
        assertEquals(UploadStatus.CANCELLED, pipeline.cancel(id).getStatus());
    }

    @Test
    void testCancelAfterCompletion_isRejected() {
        String id = pipeline.createSession(request("done.txt", 4, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("done", 4), null);
        dispatcher.runAll();

        assertThrows(InvalidTransitionException.class, () -> pipeline.cancel(id));
    }

    @Test
    void testUploadChunk_rejectsInvalidInput() {
        String id = pipeline.createSession(request("input.bin", 20, 2)).getSessionId();

        assertThrows(IllegalArgumentException.class, () -> pipeline.uploadChunk(id, 0, payload("a", 10), null));
        assertThrows(IllegalArgumentException.class, () -> pipeline.uploadChunk(id, 3, payload("a", 10), null));
        assertThrows(IllegalArgumentException.class, () -> pipeline.uploadChunk(id, 1, new byte[0], null));
        assertThrows(ChecksumMismatchException.class,
                () -> pipeline.uploadChunk(id, 1, payload("a", 10), "00000000000000000000000000000000"));
        assertEquals(UploadStatus.PENDING, session(id).getStatus());

        byte[] data = payload("a", 10);
        String md5 = ChecksumUtil.generateChecksum(data, ChecksumUtil.MD5);
        assertEquals(md5, pipeline.uploadChunk(id, 1, data, md5).getChecksum());
        String computed = pipeline.uploadChunk(id, 2, data, null).getChecksum();
        assertEquals(ChecksumUtil.generateChecksum(data, ChecksumUtil.SHA_256), computed);
    }

    @Test
    void testUploadChunk_afterCancelIsRejected() {
        String id = pipeline.createSession(request("late.bin", 20, 2)).getSessionId();
        pipeline.cancel(id);

        assertThrows(InvalidSessionStateException.class, () -> pipeline.uploadChunk(id, 1, payload("a", 10), null));
    }

    @Test
    void testCreateSession_rejectsInvalidRequests() {
        assertThrows(IllegalArgumentException.class, () -> pipeline.createSession(request("../etc/passwd", 10, 1)));
        assertThrows(IllegalArgumentException.class, () -> pipeline.createSession(request("CON.txt", 10, 1)));
        assertThrows(IllegalArgumentException.class, () -> pipeline.createSession(request("a|b.txt", 10, 1)));
        assertThrows(IllegalArgumentException.class,
                () -> pipeline.createSession(request("big.bin", PipelineSettings.FIVE_GIB + 1, 100)));
        assertThrows(IllegalArgumentException.class, () -> pipeline.createSession(request("zero.bin", 0, 1)));
        assertThrows(IllegalArgumentException.class, () -> pipeline.createSession(request("many.bin", 3, 4)));
        assertThrows(IllegalArgumentException.class,
                () -> pipeline.createSession(new CreateSessionRequest(null, null, 7L, "x.bin", 10, 1)));
    }

    @Test
    void testGetStatus_reportsProgressAndMissingChunks() {
        CreateSessionRequest request = request("progress.wav", 40, 4);
        request.setMetadata(Map.of("upload_source", "desktop"));
        String id = pipeline.createSession(request).getSessionId();
        pipeline.uploadChunk(id, 1, payload("1", 10), null);
        pipeline.uploadChunk(id, 3, payload("3", 10), null);

        SessionStatusResponse status = pipeline.getStatus(id);
        assertEquals("uploading", status.getStatus());
        assertEquals(2, status.getCompletedChunks());
        assertEquals(50.0, status.getProgressPercentage());
        assertEquals(20, status.getUploadedSize());
        assertEquals(List.of(2, 4), status.getMissingChunks());
        assertEquals(1024L * 1024, status.getRecommendedChunkSize());
        assertEquals("desktop", status.getMetadata().get("upload_source"));
    }

    @Test
    void testCompleteUpload_isIdempotentAfterAutomaticTrigger() {
        String id = pipeline.createSession(request("twice.bin", 10, 1)).getSessionId();
        pipeline.uploadChunk(id, 1, payload("x", 10), null);
        assertEquals(1, dispatcher.pending());

        assertEquals("assembling", pipeline.completeUpload(id).getStatus());
        assertEquals(1, dispatcher.pending());
    }

    @Test
    void testCreationMetadata_isCopiedToAsset() {
        CreateSessionRequest request = request("meta.aif", 10, 1);
        request.setMetadata(Map.of("client_info", "web", "original_path", "/music/meta.aif"));
        String id = pipeline.createSession(request).getSessionId();
        pipeline.uploadChunk(id, 1, payload("aif", 10), null);
        dispatcher.runAll();

        DefaultAsset asset = pipeline.findAsset(id).orElseThrow();
        assertEquals("audio/aiff", asset.getContentType());
        assertEquals("web", asset.getMetadata().get("client_info"));
        assertEquals("/music/meta.aif", asset.getMetadata().get("original_path"));

        DefaultAsset annotated = pipeline.annotateAsset(asset.getId(), Map.of("bpm", 120));
        assertEquals(120, annotated.getMetadata().get("bpm"));
        assertEquals("web", annotated.getMetadata().get("client_info"));
    }

    private static class BlockingChunkStore extends LocalFileChunkStore {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private volatile int blockedChunk;
        private volatile boolean failing;

        BlockingChunkStore(String baseDirPath) throws IOException {
            super(baseDirPath);
        }

        void armFor(int chunkNumber) {
            blockedChunk = chunkNumber;
        }

        void failNext() {
            failing = true;
        }

        @Override
        public String store(String sessionId, int chunkNumber, InputStream data) {
            if (failing) {
                failing = false;
                throw new ChunkStorageException("disk full");
            }
            if (chunkNumber == blockedChunk) {
                blockedChunk = 0;
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return super.store(sessionId, chunkNumber, data);
        }
    }
}
