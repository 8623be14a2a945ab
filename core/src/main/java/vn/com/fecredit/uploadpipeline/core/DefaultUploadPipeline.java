package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultAsset;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultChunk;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultUploadSession;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultAssetPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultChunkPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultSessionEventPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultSessionHistoryPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultUploadSessionPort;
import vn.com.fecredit.uploadpipeline.port.impl.LocalFileChunkStore;
import vn.com.fecredit.uploadpipeline.port.impl.LocalFileDurableStorage;
import vn.com.fecredit.uploadpipeline.port.interfaces.IVirusScanner;

import java.io.IOException;
import java.time.Clock;

/**
 * Pipeline over the in-memory ports and local-filesystem stores.
 */
public class DefaultUploadPipeline extends AbstractUploadPipeline<DefaultUploadSession, DefaultChunk, DefaultAsset> {

    private static final Logger log = LoggerFactory.getLogger(DefaultUploadPipeline.class);

    public DefaultUploadPipeline(String chunkDirPath, String assetDirPath, IVirusScanner scanner,
                                 StageDispatcher dispatcher, Clock clock, PipelineSettings settings) throws IOException {
        this(new DefaultSessionEventPort(), chunkDirPath, assetDirPath, scanner, dispatcher, clock, settings);
    }

    private DefaultUploadPipeline(DefaultSessionEventPort eventPort, String chunkDirPath, String assetDirPath,
                                  IVirusScanner scanner, StageDispatcher dispatcher, Clock clock,
                                  PipelineSettings settings) throws IOException {
        super(new DefaultUploadSessionPort(eventPort), new DefaultChunkPort(), new DefaultAssetPort(), eventPort,
                new DefaultSessionHistoryPort(), new LocalFileChunkStore(chunkDirPath), scanner,
                new LocalFileDurableStorage(assetDirPath), dispatcher, clock, settings);
        log.debug("Created in-memory upload pipeline: chunks={}, assets={}", chunkDirPath, assetDirPath);
    }

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
}
