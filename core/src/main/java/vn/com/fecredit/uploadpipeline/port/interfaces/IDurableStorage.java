package vn.com.fecredit.uploadpipeline.port.interfaces;

import java.io.InputStream;

/**
 * Permanent blob storage that finalized uploads are attached to.
 */
public interface IDurableStorage {

    /**
     * Copies the content into durable storage.
     *
     * @return an opaque reference to the stored blob
     */
    String attach(InputStream content, long size, String filename, String contentType);

    /**
     * Opens a stored blob. The caller closes the stream.
     */
    InputStream open(String reference);
}
