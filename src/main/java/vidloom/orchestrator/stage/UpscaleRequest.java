package vidloom.orchestrator.stage;

/**
 * Frames to enlarge by an integer {@code scaleFactor} in both dimensions.
 */
public record UpscaleRequest(FrameBatch frames, int scaleFactor) {
}
