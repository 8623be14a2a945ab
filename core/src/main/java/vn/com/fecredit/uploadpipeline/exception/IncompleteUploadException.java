package vn.com.fecredit.uploadpipeline.exception;

import java.util.List;

public class IncompleteUploadException extends UploadPipelineException {

    private final List<Integer> missingChunks;

    public IncompleteUploadException(String sessionId, List<Integer> missingChunks) {
        super("Upload " + sessionId + " is incomplete, missing chunks: " + missingChunks, false);
        this.missingChunks = List.copyOf(missingChunks);
    }

    public List<Integer> getMissingChunks() {
        return missingChunks;
    }
}
