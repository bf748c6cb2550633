package vidloom.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import vidloom.orchestrator.model.AspectRatio;
import vidloom.orchestrator.model.BaseModel;
import vidloom.orchestrator.model.GenerationRequest;
import vidloom.orchestrator.model.ResolutionClass;

/**
 * Request DTO for creating a new job.
 * POST /api/v1/jobs
 *
 * Only {@code prompt} is required; everything else has a default.
 */
public record CreateJobRequest(
        @JsonProperty("prompt") String prompt,
        @JsonProperty("negativePrompt") String negativePrompt,
        @JsonProperty("aspectRatio") String aspectRatio,
        @JsonProperty("resolution") Integer resolution,
        @JsonProperty("videoLength") Integer videoLength,
        @JsonProperty("fps") Integer fps,
        @JsonProperty("outputFormat") String outputFormat,
        @JsonProperty("baseModel") String baseModel,
        @JsonProperty("motionAdapter") String motionAdapter,
        @JsonProperty("inferenceSteps") Integer inferenceSteps,
        @JsonProperty("ownerId") String ownerId) {

    public static final String DEFAULT_ASPECT_RATIO = "16:9";
    public static final int DEFAULT_RESOLUTION = 512;
    public static final int DEFAULT_VIDEO_LENGTH = 4;
    public static final int DEFAULT_FPS = 8;
    public static final String DEFAULT_FORMAT = "mp4";
    public static final String DEFAULT_BASE_MODEL = "sd15";
    public static final int DEFAULT_INFERENCE_STEPS = 25;

    /**
     * @throws IllegalArgumentException if any field is invalid
     */
    public GenerationRequest toGenerationRequest() {
        return new GenerationRequest(
                prompt,
                negativePrompt != null ? negativePrompt : "",
                AspectRatio.fromLabel(aspectRatio != null ? aspectRatio : DEFAULT_ASPECT_RATIO),
                ResolutionClass.fromHeight(resolution != null ? resolution : DEFAULT_RESOLUTION),
                videoLength != null ? videoLength : DEFAULT_VIDEO_LENGTH,
                fps != null ? fps : DEFAULT_FPS,
                outputFormat != null ? outputFormat.toLowerCase() : DEFAULT_FORMAT,
                BaseModel.fromId(baseModel != null ? baseModel : DEFAULT_BASE_MODEL),
                motionAdapter,
                inferenceSteps != null ? inferenceSteps : DEFAULT_INFERENCE_STEPS);
    }
}
