package uk.gegc.formbatch.features.storage.application;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Opaque blob store for templates, data files, per-row artifacts and ZIP outputs.
 * References returned by {@link #store} are the only handle callers keep.
 */
public interface FileStore {

    /** Stores the bytes and returns a reference to them. {@code fileName} is a hint only. */
    String store(byte[] content, String fileName);

    /**
     * Stores whatever the writer produces without holding it in memory. The blob becomes
     * visible only once the writer returns; if it fails nothing is kept.
     */
    String storeFrom(String fileName, ContentWriter writer);

    byte[] read(String ref);

    /** Removes the blob; an unknown reference is ignored. */
    void delete(String ref);

    long size(String ref);

    boolean exists(String ref);

    @FunctionalInterface
    interface ContentWriter {
        void writeTo(OutputStream out) throws IOException;
    }
}
