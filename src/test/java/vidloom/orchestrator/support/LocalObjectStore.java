package vidloom.orchestrator.support;

import vidloom.orchestrator.storage.ObjectStore;
import vidloom.orchestrator.storage.StoredObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * ObjectStore that copies uploads into a local directory laid out as
 * {@code <root>/<bucket>/<objectKey>}.
 */
public class LocalObjectStore implements ObjectStore {

    private final Path root;
    private final String bucket;

    public LocalObjectStore(Path root, String bucket) {
        this.root = root;
        this.bucket = bucket;
    }

    @Override
    public StoredObject upload(Path localFile, String jobId) throws IOException {
        String key = ObjectStore.objectKey(jobId, localFile);
        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING);
        return new StoredObject(bucket, key, Files.size(target));
    }

    @Override
    public String bucketName() {
        return bucket;
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(root);
    }

    public Path resolve(String objectKey) {
        return root.resolve(bucket).resolve(objectKey);
    }
}
