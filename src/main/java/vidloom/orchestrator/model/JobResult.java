package vidloom.orchestrator.model;

import java.time.Instant;

/**
 * Location of a finished job's artifact in object storage.
 */
public record JobResult(
        String jobId,
        String objectKey,
        String bucket,
        long sizeBytes,
        Instant createdAt) {
}
