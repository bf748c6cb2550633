package vidloom.orchestrator.stage;

import java.util.Map;

/**
 * Input of the core frame generator, at generation resolution and base frame rate.
 */
public record GenerateRequest(
        String prompt,
        String negativePrompt,
        int width,
        int height,
        int videoLength,
        int fps,
        int inferenceSteps,
        double guidanceScale,
        long seed,
        String baseModel,
        String motionAdapter,
        Map<String, Double> loras) {

    public GenerateRequest {
        loras = loras != null ? Map.copyOf(loras) : Map.of();
    }

    public int frameCount() {
        return videoLength * fps;
    }
}
