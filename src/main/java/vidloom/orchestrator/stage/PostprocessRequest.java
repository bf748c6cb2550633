package vidloom.orchestrator.stage;

import java.nio.file.Path;

/**
 * Final frames plus everything needed to fit them to the requested output and
 * write the video file.
 */
public record PostprocessRequest(
        FrameBatch frames,
        int targetDuration,
        int fps,
        int targetWidth,
        int targetHeight,
        String prompt,
        long seed,
        String outputFormat,
        Path outputDir) {
}
