package vidloom.orchestrator.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalFilesTest {

    @TempDir
    Path dir;

    @Test
    void deletesExistingFile() throws IOException {
        Path file = Files.writeString(dir.resolve("video.gif"), "GIF89a");

        assertTrue(LocalFiles.delete(file));
        assertFalse(Files.exists(file));
    }

    @Test
    void missingFileCountsAsDeleted() {
        assertTrue(LocalFiles.delete(dir.resolve("never-written.gif")));
        assertTrue(LocalFiles.delete(null));
    }

    @Test
    void failureIsReportedNotThrown() throws IOException {
        Path nonEmpty = Files.createDirectory(dir.resolve("outputs"));
        Files.writeString(nonEmpty.resolve("video.gif"), "GIF89a");

        assertFalse(LocalFiles.delete(nonEmpty));
        assertTrue(Files.exists(nonEmpty));
    }
}
