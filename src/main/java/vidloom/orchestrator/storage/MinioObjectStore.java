package vidloom.orchestrator.storage;

import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.UploadObjectArgs;
import io.minio.errors.MinioException;
import vidloom.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Locale;

/**
 * {@link ObjectStore} backed by a MinIO (S3 compatible) bucket.
 * The bucket is created on first upload if it does not exist.
 */
public class MinioObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(MinioObjectStore.class);

    private final MinioClient client;
    private final String bucket;
    private volatile boolean bucketReady = false;

    public MinioObjectStore(OrchestratorConfig config) {
        this(MinioClient.builder()
                .endpoint(config.minioEndpoint())
                .credentials(config.minioAccessKey(), config.minioSecretKey())
                .build(),
                config.minioBucket());
        log.info("MinIO object store: endpoint={}, bucket={}", config.minioEndpoint(), bucket);
    }

    public MinioObjectStore(MinioClient client, String bucket) {
        this.client = client;
        this.bucket = bucket;
    }

    @Override
    public StoredObject upload(Path localFile, String jobId) throws IOException {
        if (!Files.isRegularFile(localFile)) {
            throw new IOException("Nothing to upload, file not found: " + localFile);
        }

        String objectKey = ObjectStore.objectKey(jobId, localFile);
        long size = Files.size(localFile);
        try {
            ensureBucket();
            client.uploadObject(UploadObjectArgs.builder()
                    .bucket(bucket)
                    .object(objectKey)
                    .filename(localFile.toString())
                    .contentType(contentType(localFile))
                    .build());
        } catch (MinioException | GeneralSecurityException e) {
            throw new IOException("Failed to upload " + localFile + " as " + objectKey + ": " + e.getMessage(), e);
        }

        log.info("Video uploaded: {}/{} ({} bytes)", bucket, objectKey, size);
        return new StoredObject(bucket, objectKey, size);
    }

    @Override
    public String bucketName() {
        return bucket;
    }

    @Override
    public boolean isAvailable() {
        try {
            client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            return true;
        } catch (Exception e) {
            log.warn("MinIO connection check failed: {}", e.getMessage());
            return false;
        }
    }

    private void ensureBucket() throws MinioException, GeneralSecurityException, IOException {
        if (bucketReady) {
            return;
        }
        synchronized (this) {
            if (bucketReady) {
                return;
            }
            boolean exists = client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (!exists) {
                client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created bucket {}", bucket);
            }
            bucketReady = true;
        }
    }

    static String contentType(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".gif")) {
            return "image/gif";
        }
        if (name.endsWith(".mp4")) {
            return "video/mp4";
        }
        if (name.endsWith(".webm")) {
            return "video/webm";
        }
        return "application/octet-stream";
    }
}
