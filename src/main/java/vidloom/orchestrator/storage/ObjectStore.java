package vidloom.orchestrator.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Durable storage for finished videos.
 */
public interface ObjectStore {

    /**
     * Upload a local file as the artifact of {@code jobId}.
     * The object key is {@code {jobId}/{jobId}{ext}}.
     */
    StoredObject upload(Path localFile, String jobId) throws IOException;

    String bucketName();

    /**
     * @return true if the backing store answers
     */
    boolean isAvailable();

    /**
     * Delete a local intermediate file.
     *
     * @return true if the file is gone afterwards, including when it never existed
     */
    default boolean cleanupLocal(Path localFile) {
        return LocalFiles.delete(localFile);
    }

    static String objectKey(String jobId, Path localFile) {
        String name = localFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot) : "";
        return jobId + "/" + jobId + extension;
    }
}
