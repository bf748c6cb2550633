package vidloom.orchestrator.pipeline;

/**
 * The five stage kinds, in pipeline order.
 */
public enum StageKind {
    PREPROCESS("preprocess", "parameter processing", "Processing parameters"),
    GENERATE("generate", "frame generation", "Generating frames"),
    INTERPOLATE("interpolate", "frame interpolation", "Interpolating frames"),
    UPSCALE("upscale", "frame upscaling", "Upscaling frames"),
    POSTPROCESS("postprocess", "postprocessing", "Saving video");

    private final String id;
    private final String operation;
    private final String stepLabel;

    StageKind(String id, String operation, String stepLabel) {
        this.id = id;
        this.operation = operation;
        this.stepLabel = stepLabel;
    }

    /** Short id used in config sections and thread names. */
    public String id() {
        return id;
    }

    /** Operation name used in log lines. */
    public String operation() {
        return operation;
    }

    /** Prefix of the job's current step while this stage reports progress. */
    public String stepLabel() {
        return stepLabel;
    }

    public static StageKind fromId(String id) {
        for (StageKind kind : values()) {
            if (kind.id.equals(id)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + id);
    }
}
