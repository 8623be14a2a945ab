package vn.com.fecredit.uploadpipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import vn.com.fecredit.uploadpipeline.core.AbstractUploadPipeline;
import vn.com.fecredit.uploadpipeline.core.PipelineSettings;
import vn.com.fecredit.uploadpipeline.core.StageDispatcher;
import vn.com.fecredit.uploadpipeline.model.Asset;
import vn.com.fecredit.uploadpipeline.model.Chunk;
import vn.com.fecredit.uploadpipeline.model.UploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkStore;
import vn.com.fecredit.uploadpipeline.port.interfaces.IDurableStorage;
import vn.com.fecredit.uploadpipeline.port.interfaces.IVirusScanner;
import vn.com.fecredit.uploadpipeline.port.jpa.JpaAssetPort;
import vn.com.fecredit.uploadpipeline.port.jpa.JpaChunkPort;
import vn.com.fecredit.uploadpipeline.port.jpa.JpaSessionEventPort;
import vn.com.fecredit.uploadpipeline.port.jpa.JpaSessionHistoryPort;
import vn.com.fecredit.uploadpipeline.port.jpa.JpaUploadSessionPort;

import java.io.IOException;
import java.time.Clock;

/**
 * Upload pipeline backed by the JPA ports.
 */
@Component
public class ServerUploadPipeline extends AbstractUploadPipeline<UploadSession, Chunk, Asset> {

    private static final Logger log = LoggerFactory.getLogger(ServerUploadPipeline.class);

    public ServerUploadPipeline(JpaUploadSessionPort sessionPort,
                                JpaChunkPort chunkPort,
                                JpaAssetPort assetPort,
                                JpaSessionEventPort eventPort,
                                JpaSessionHistoryPort historyPort,
                                IChunkStore chunkStore,
                                IVirusScanner scanner,
                                IDurableStorage durableStorage,
                                StageDispatcher dispatcher,
                                Clock clock,
                                PipelineSettings settings) throws IOException {
        super(sessionPort, chunkPort, assetPort, eventPort, historyPort, chunkStore, scanner, durableStorage,
                dispatcher, clock, settings);
        log.info("Upload pipeline started with scanner '{}', assembly dir {}", scanner.getName(),
                settings.getAssemblyDir());
    }

    @Override
    protected UploadSession newSession() {
        return new UploadSession();
    }

    @Override
    protected Chunk newChunk() {
        return new Chunk();
    }

    @Override
    protected Asset newAsset() {
        return new Asset();
    }
}
