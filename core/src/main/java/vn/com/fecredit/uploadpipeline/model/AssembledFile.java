package vn.com.fecredit.uploadpipeline.model;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Temporary file produced by concatenating all chunks of a session.
 */
@Getter
@ToString
public final class AssembledFile {

    private final String sessionId;
    private final Path path;
    private final long size;

    public AssembledFile(String sessionId, Path path, long size) {
        this.sessionId = sessionId;
        this.path = path;
        this.size = size;
    }
}
