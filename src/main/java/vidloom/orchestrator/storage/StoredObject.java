package vidloom.orchestrator.storage;

/**
 * An artifact uploaded to object storage.
 */
public record StoredObject(String bucket, String objectKey, long sizeBytes) {
}
