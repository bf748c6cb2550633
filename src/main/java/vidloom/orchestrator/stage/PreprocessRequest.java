package vidloom.orchestrator.stage;

/**
 * Target video parameters the preprocessor derives a generation plan from.
 */
public record PreprocessRequest(int width, int height, int videoLength, int targetFps) {
}
