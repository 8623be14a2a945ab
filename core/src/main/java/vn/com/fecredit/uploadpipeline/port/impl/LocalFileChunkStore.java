package vn.com.fecredit.uploadpipeline.port.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.ChunkNotFoundException;
import vn.com.fecredit.uploadpipeline.exception.ChunkStorageException;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Chunk store on the local filesystem.
 *
 * <p>
 * Layout: {@code <base>/session_<sessionId>/chunk_<n>.tmp}. Each chunk is written to a
 * temp sibling and moved into place atomically, so a retry of the same chunk number
 * replaces the earlier copy and readers never see a half-written file.
 */
public class LocalFileChunkStore implements IChunkStore {

    private static final Logger log = LoggerFactory.getLogger(LocalFileChunkStore.class);

    private final Path baseDir;

    public LocalFileChunkStore(String baseDirPath) throws IOException {
        this.baseDir = Paths.get(baseDirPath).toAbsolutePath().normalize();
        Files.createDirectories(this.baseDir);
    }

    public static String storageKey(String sessionId, int chunkNumber) {
        return sessionDirName(sessionId) + "/chunk_" + chunkNumber + ".tmp";
    }

    private static String sessionDirName(String sessionId) {
        return "session_" + sessionId;
    }

    @Override
    public String store(String sessionId, int chunkNumber, InputStream data) {
        String key = storageKey(sessionId, chunkNumber);
        Path target = resolve(key);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "chunk_" + chunkNumber + "_", ".part");
            Files.copy(data, temp, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Stored chunk {} of session {} at {}", chunkNumber, sessionId, target);
            return key;
        } catch (IOException e) {
            deleteTemp(temp);
            throw new ChunkStorageException("Failed to store chunk " + chunkNumber + " of session " + sessionId, e);
        }
    }

    @Override
    public boolean exists(String storageKey) {
        return Files.isRegularFile(resolve(storageKey));
    }

    @Override
    public long size(String storageKey) {
        try {
            return Files.size(resolve(storageKey));
        } catch (NoSuchFileException e) {
            throw new ChunkNotFoundException("Chunk not found: " + storageKey, e);
        } catch (IOException e) {
            throw new ChunkStorageException("Failed to read size of chunk " + storageKey, e);
        }
    }

    @Override
    public InputStream read(String storageKey) {
        try {
            return Files.newInputStream(resolve(storageKey));
        } catch (NoSuchFileException e) {
            throw new ChunkNotFoundException("Chunk not found: " + storageKey, e);
        } catch (IOException e) {
            throw new ChunkStorageException("Failed to open chunk " + storageKey, e);
        }
    }

    @Override
    public boolean delete(String storageKey) {
        try {
            return Files.deleteIfExists(resolve(storageKey));
        } catch (IOException e) {
            throw new ChunkStorageException("Failed to delete chunk " + storageKey, e);
        }
    }

    @Override
    public void deleteSession(String sessionId) {
        Path dir = resolve(sessionDirName(sessionId));
        if (!Files.isDirectory(dir)) {
            return;
        }
        try {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
                for (Path file : files) {
                    Files.deleteIfExists(file);
                }
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            throw new ChunkStorageException("Failed to delete chunk directory of session " + sessionId, e);
        }
    }

    private Path resolve(String key) {
        Path path = baseDir.resolve(key).normalize();
        if (!path.startsWith(baseDir)) {
            throw new IllegalArgumentException("Storage key escapes the chunk directory: " + key);
        }
        return path;
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete partial chunk file {}: {}", temp, e.getMessage());
        }
    }
}
