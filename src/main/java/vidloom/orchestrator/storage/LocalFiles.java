package vidloom.orchestrator.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Removal of local intermediate files.
 */
public final class LocalFiles {

    private static final Logger log = LoggerFactory.getLogger(LocalFiles.class);

    private LocalFiles() {
    }

    /**
     * Delete {@code file}, logging instead of throwing on failure.
     *
     * @return true if the file is gone afterwards, including when it never existed
     */
    public static boolean delete(Path file) {
        if (file == null) {
            return true;
        }
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Cleaned up local file: {}", file);
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to clean up local file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
