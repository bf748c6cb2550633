package vidloom.orchestrator.model;

import java.util.Objects;
import java.util.Set;

/**
 * A user's generation request, before conversion into a {@link GenerationSpec}.
 */
public record GenerationRequest(
        String prompt,
        String negativePrompt,
        AspectRatio aspectRatio,
        ResolutionClass resolution,
        int videoLength,
        int fps,
        String outputFormat,
        BaseModel baseModel,
        String motionAdapter,
        int inferenceSteps) {

    public static final Set<Integer> SUPPORTED_FPS = Set.of(8, 16, 24, 32);
    public static final Set<String> SUPPORTED_FORMATS = Set.of("mp4", "webm", "gif");
    public static final int MAX_INFERENCE_STEPS = 100;

    public GenerationRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        Objects.requireNonNull(aspectRatio, "aspectRatio is required");
        Objects.requireNonNull(resolution, "resolution is required");
        Objects.requireNonNull(baseModel, "baseModel is required");
        if (videoLength < 1) {
            throw new IllegalArgumentException("videoLength must be at least 1 second");
        }
        if (!SUPPORTED_FPS.contains(fps)) {
            throw new IllegalArgumentException("fps must be one of 8, 16, 24, 32");
        }
        if (outputFormat == null || !SUPPORTED_FORMATS.contains(outputFormat)) {
            throw new IllegalArgumentException("outputFormat must be one of mp4, webm, gif");
        }
        if (inferenceSteps < 1 || inferenceSteps > MAX_INFERENCE_STEPS) {
            throw new IllegalArgumentException("inferenceSteps must be between 1 and " + MAX_INFERENCE_STEPS);
        }
        if (motionAdapter == null || motionAdapter.isBlank()) {
            motionAdapter = "default";
        }
    }
}
