package vn.com.fecredit.uploadpipeline.port.jpa;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import vn.com.fecredit.uploadpipeline.model.Asset;
import vn.com.fecredit.uploadpipeline.model.AssetRepository;
import vn.com.fecredit.uploadpipeline.model.SessionOutcome;
import vn.com.fecredit.uploadpipeline.model.UploadSession;
import vn.com.fecredit.uploadpipeline.model.UploadSessionHistory;
import vn.com.fecredit.uploadpipeline.model.UploadSessionHistoryRepository;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers the asset and history adapters against the H2 schema.
 */
@SpringBootTest
public class JpaAssetPortTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 10, 0);

    @Autowired
    private JpaAssetPort assetPort;

    @Autowired
    private AssetRepository assetRepository;

    @Autowired
    private JpaSessionHistoryPort historyPort;

    @Autowired
    private UploadSessionHistoryRepository historyRepository;

    @BeforeEach
    public void setup() {
        assetRepository.deleteAll();
        historyRepository.deleteAll();
    }

    private static Asset asset(String sessionId, Long containerId, String filename) {
        Asset asset = new Asset();
        asset.setUploadSessionId(sessionId);
        asset.setWorkspaceId(5L);
        asset.setContainerId(containerId);
        asset.setUserId(9L);
        asset.setFilename(filename);
        asset.setFileSize(2044);
        asset.setContentType("audio/wav");
        asset.setStorageReference("ref-" + sessionId);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("upload_session_id", sessionId);
        asset.setMetadata(metadata);
        asset.setCreatedAt(T0);
        return asset;
    }

    @Test
    public void testSecondAssetForSameSessionReturnsFirst() {
        Asset first = assetPort.createAsset(asset("s-1", null, "track.wav"));
        Asset second = assetPort.createAsset(asset("s-1", null, "other.wav"));

        assertEquals(first.getId(), second.getId());
        assertEquals("track.wav", second.getFilename());
        assertEquals(1, assetRepository.count());
    }

    @Test
    public void testExistsByLocationDistinguishesRootAndContainer() {
        assetPort.createAsset(asset("s-1", null, "track.wav"));
        assetPort.createAsset(asset("s-2", 3L, "song.wav"));

        assertTrue(assetPort.existsByLocation(5L, null, "track.wav"));
        assertFalse(assetPort.existsByLocation(5L, 3L, "track.wav"));
        assertTrue(assetPort.existsByLocation(5L, 3L, "song.wav"));
        assertFalse(assetPort.existsByLocation(5L, null, "song.wav"));
        assertFalse(assetPort.existsByLocation(6L, null, "track.wav"));
    }

    @Test
    public void testAnnotateMergesMetadata() {
        Asset created = assetPort.createAsset(asset("s-1", null, "track.wav"));

        assetPort.annotate(created.getId(), Map.of("waveform", "done"));

        Map<String, Object> metadata = assetPort.findByUploadSessionId("s-1").orElseThrow().getMetadata();
        assertEquals("s-1", metadata.get("upload_session_id"));
        assertEquals("done", metadata.get("waveform"));
    }

    @Test
    public void testArchiveOverwritesEarlierRecord() {
        UploadSession session = new UploadSession();
        session.setSessionId("h-1");
        session.setWorkspaceId(5L);
        session.setUserId(9L);
        session.setFilename("track.wav");
        session.setTotalSize(2044);
        session.setChunksCount(2);
        session.setStatus(UploadStatus.FAILED);
        session.setCreatedAt(T0);
        session.setUpdatedAt(T0);

        historyPort.archive(session, SessionOutcome.EXPIRED, T0.plusHours(1));
        historyPort.archive(session, SessionOutcome.FAILED, T0.plusHours(2));

        List<UploadSessionHistory> failed = historyRepository.findByOutcome(SessionOutcome.FAILED);
        assertEquals(1, historyRepository.count());
        assertEquals(1, failed.size());
        assertEquals(UploadStatus.FAILED, failed.get(0).getFinalStatus());
        assertEquals(T0.plusHours(2), failed.get(0).getArchivedAt());
        assertTrue(historyRepository.findByOutcome(SessionOutcome.EXPIRED).isEmpty());
    }
}
