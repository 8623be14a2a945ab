package vn.com.fecredit.uploadpipeline.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.model.ChunkReceipt;
import vn.com.fecredit.uploadpipeline.model.CreateSessionRequest;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.SessionStatusResponse;
import vn.com.fecredit.uploadpipeline.model.SweepReport;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IAsset;
import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.IAssetPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkStore;
import vn.com.fecredit.uploadpipeline.port.interfaces.IDurableStorage;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionHistoryPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IUploadSessionPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IVirusScanner;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chunked upload pipeline: session management, assembly, virus scanning, finalization and cleanup
 * wired over a set of ports.
 *
 * <p>
 * Each stage runs through the {@link StageDispatcher} once the previous stage has committed:
 * the chunk that completes a session dispatches assembly, a committed assembly dispatches the
 * scan, and a clean or skipped scan dispatches finalization. A stage that fails for good moves
 * the session to that stage's failure status.
 *
 * <p>
 * Concrete pipelines supply the session, chunk and asset types through the factory methods.
 */
public abstract class AbstractUploadPipeline<S extends IUploadSession, C extends IChunk, A extends IAsset> {

    private static final Logger log = LoggerFactory.getLogger(AbstractUploadPipeline.class);

    static final String ASSEMBLY = "assembly";
    static final String VIRUS_SCAN = "virus-scan";
    static final String FINALIZATION = "finalization";

    @Getter
    private final IUploadSessionPort<S> sessionPort;
    @Getter
    private final IChunkPort<C> chunkPort;
    @Getter
    private final IAssetPort<A> assetPort;
    @Getter
    private final ISessionEventPort eventPort;
    @Getter
    private final ISessionHistoryPort historyPort;
    @Getter
    private final IChunkStore chunkStore;
    @Getter
    private final IDurableStorage durableStorage;
    @Getter
    private final StageDispatcher dispatcher;
    @Getter
    private final SessionStateMachine<S> stateMachine;

    private final UploadSessionManager<S, C> sessionManager;
    private final UploadAssembler<S, C> assembler;
    private final ScannerGateway<S> scannerGateway;
    private final UploadFinalizer<S, A> finalizer;
    private final UploadCleanupSweeper<S, C> sweeper;

    protected AbstractUploadPipeline(IUploadSessionPort<S> sessionPort, IChunkPort<C> chunkPort,
                                     IAssetPort<A> assetPort, ISessionEventPort eventPort,
                                     ISessionHistoryPort historyPort, IChunkStore chunkStore,
                                     IVirusScanner scanner, IDurableStorage durableStorage,
                                     StageDispatcher dispatcher, Clock clock,
                                     PipelineSettings settings) throws IOException {
        this.sessionPort = sessionPort;
        this.chunkPort = chunkPort;
        this.assetPort = assetPort;
        this.eventPort = eventPort;
        this.historyPort = historyPort;
        this.chunkStore = chunkStore;
        this.durableStorage = durableStorage;
        this.dispatcher = dispatcher;
        this.stateMachine = new SessionStateMachine<>(sessionPort, clock);
        this.sessionManager = new UploadSessionManager<>(stateMachine, sessionPort, chunkPort, eventPort, chunkStore,
                this::newSession, this::newChunk, settings);
        this.assembler = new UploadAssembler<>(stateMachine, chunkPort, assetPort, chunkStore,
                settings.getAssemblyDir());
        this.scannerGateway = new ScannerGateway<>(stateMachine, scanner);
        this.finalizer = new UploadFinalizer<>(stateMachine, assetPort, eventPort, durableStorage, this::newAsset);
        this.sweeper = new UploadCleanupSweeper<>(stateMachine, sessionPort, chunkPort, eventPort, historyPort,
                chunkStore, finalizer, settings);
    }

    protected abstract S newSession();

    protected abstract C newChunk();

    protected abstract A newAsset();

    public S createSession(CreateSessionRequest request) {
        return sessionManager.createSession(request);
    }

    public ChunkReceipt uploadChunk(String sessionId, int chunkNumber, byte[] payload, String checksum) {
        ChunkReceipt receipt = sessionManager.uploadChunk(sessionId, chunkNumber, payload, checksum);
        if (receipt.isAssemblyTriggered()) {
            log.info("All chunks of session {} received, dispatching assembly", sessionId);
            dispatchAssembly(sessionId);
        }
        return receipt;
    }

    public SessionStatusResponse completeUpload(String sessionId) {
        if (sessionManager.completeUpload(sessionId)) {
            dispatchAssembly(sessionId);
        }
        return sessionManager.getStatus(sessionId);
    }

    public S cancel(String sessionId) {
        S session = sessionManager.cancel(sessionId);
        log.info("Upload session {} cancelled", sessionId);
        return session;
    }

    public SessionStatusResponse getStatus(String sessionId) {
        return sessionManager.getStatus(sessionId);
    }

    public Optional<S> findSession(String sessionId) {
        return stateMachine.find(sessionId);
    }

    public Optional<A> findAsset(String sessionId) {
        return assetPort.findByUploadSessionId(sessionId);
    }

    public A annotateAsset(Long assetId, Map<String, Object> metadata) {
        return assetPort.annotate(assetId, metadata);
    }

    public boolean canAssemble(String sessionId) {
        return stateMachine.find(sessionId).map(assembler::canAssemble).orElse(false);
    }

    public SweepReport sweep() {
        return sweeper.sweep();
    }

    /**
     * Re-dispatches the stage a session is waiting in, e.g. after a restart lost queued stages.
     *
     * @return {@code true} if a stage was dispatched
     */
    public boolean resume(String sessionId) {
        S session = stateMachine.require(sessionId);
        switch (session.getStatus()) {
            case ASSEMBLING:
                dispatchAssembly(sessionId);
                return true;
            case VIRUS_SCANNING:
                dispatchScan(sessionId);
                return true;
            case FINALIZING:
                dispatchFinalization(sessionId);
                return true;
            default:
                return false;
        }
    }

    protected void dispatchAssembly(String sessionId) {
        dispatcher.dispatch(new AssemblyTask(sessionId));
    }

    protected void dispatchScan(String sessionId) {
        dispatcher.dispatch(new ScanTask(sessionId));
    }

    protected void dispatchFinalization(String sessionId) {
        dispatcher.dispatch(new FinalizationTask(sessionId));
    }

    private abstract static class SessionStage implements StageTask {
        private final String name;
        private final String sessionId;

        SessionStage(String name, String sessionId) {
            this.name = name;
            this.sessionId = sessionId;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }
    }

    private class AssemblyTask extends SessionStage {
        AssemblyTask(String sessionId) {
            super(ASSEMBLY, sessionId);
        }

        @Override
        public void execute() {
            if (assembler.assemble(sessionId()).isPresent()) {
                dispatchScan(sessionId());
            }
        }

        @Override
        public void onFailure(RuntimeException lastError) {
            stateMachine.transition(sessionId(), Set.of(UploadStatus.ASSEMBLING), UploadStatus.FAILED,
                    SessionEventType.ERROR, Map.of("stage", ASSEMBLY), "Assembly failed: " + lastError.getMessage(), null);
        }
    }

    private class ScanTask extends SessionStage {
        ScanTask(String sessionId) {
            super(VIRUS_SCAN, sessionId);
        }

        @Override
        public void execute() {
            if (scannerGateway.scan(sessionId())) {
                dispatchFinalization(sessionId());
            }
        }

        @Override
        public void onFailure(RuntimeException lastError) {
            scannerGateway.markFailed(sessionId(), lastError);
        }
    }

    private class FinalizationTask extends SessionStage {
        FinalizationTask(String sessionId) {
            super(FINALIZATION, sessionId);
        }

        @Override
        public void execute() {
            finalizer.finalizeUpload(sessionId());
        }

        @Override
        public void onFailure(RuntimeException lastError) {
            finalizer.markFailed(sessionId(), lastError);
        }
    }
}
