package vidloom.orchestrator.stage;

/**
 * Frames to densify by {@code factor}: {@code n} frames become {@code (n - 1) * factor + 1}.
 */
public record InterpolateRequest(FrameBatch frames, int factor) {
}
