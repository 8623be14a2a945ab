package vn.com.fecredit.uploadpipeline.port.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.DurableStorageException;
import vn.com.fecredit.uploadpipeline.port.interfaces.IDurableStorage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Durable storage on the local filesystem. References have the form {@code <uuid>/<filename>}.
 */
public class LocalFileDurableStorage implements IDurableStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalFileDurableStorage.class);

    private final Path baseDir;

    public LocalFileDurableStorage(String baseDirPath) throws IOException {
        this.baseDir = Paths.get(baseDirPath).toAbsolutePath().normalize();
        Files.createDirectories(this.baseDir);
    }

    @Override
    public String attach(InputStream content, long size, String filename, String contentType) {
        String reference = UUID.randomUUID() + "/" + filename;
        Path target = resolve(reference);
        try {
            Files.createDirectories(target.getParent());
            long copied = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            if (copied != size) {
                Files.deleteIfExists(target);
                throw new DurableStorageException("Stored " + copied + " bytes for " + filename + ", expected " + size);
            }
        } catch (IOException e) {
            throw new DurableStorageException("Failed to attach " + filename + " to durable storage", e);
        }
        log.debug("Attached {} ({} bytes, {}) as {}", filename, size, contentType, reference);
        return reference;
    }

    @Override
    public InputStream open(String reference) {
        try {
            return Files.newInputStream(resolve(reference));
        } catch (IOException e) {
            throw new DurableStorageException("Failed to open stored blob " + reference, e);
        }
    }

    private Path resolve(String reference) {
        Path path = baseDir.resolve(reference).normalize();
        if (!path.startsWith(baseDir)) {
            throw new IllegalArgumentException("Reference escapes the storage directory: " + reference);
        }
        return path;
    }
}
