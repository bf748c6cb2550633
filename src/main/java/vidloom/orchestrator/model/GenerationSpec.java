package vidloom.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable pipeline input for one job.
 * Persisted with the job at creation time and never modified afterwards.
 */
public final class GenerationSpec {
    private final String prompt;
    private final String negativePrompt;
    private final int width;
    private final int height;
    private final int videoLength; // seconds
    private final int fps;
    private final String baseModel;
    private final String motionAdapter;
    private final Map<String, Double> loras;
    private final int inferenceSteps;
    private final double guidanceScale;
    private final long seed;
    private final String outputFormat;

    private GenerationSpec(Builder builder) {
        this.prompt = Objects.requireNonNull(builder.prompt, "prompt is required");
        this.negativePrompt = builder.negativePrompt != null ? builder.negativePrompt : "";
        this.width = builder.width;
        this.height = builder.height;
        this.videoLength = builder.videoLength;
        this.fps = builder.fps;
        this.baseModel = Objects.requireNonNull(builder.baseModel, "baseModel is required");
        this.motionAdapter = builder.motionAdapter != null ? builder.motionAdapter : "default";
        this.loras = Collections.unmodifiableMap(new LinkedHashMap<>(builder.loras));
        this.inferenceSteps = builder.inferenceSteps;
        this.guidanceScale = builder.guidanceScale;
        this.seed = builder.seed;
        this.outputFormat = Objects.requireNonNull(builder.outputFormat, "outputFormat is required");

        if (width < 8 || height < 8) {
            throw new IllegalArgumentException("width and height must be at least 8, got " + width + "x" + height);
        }
        if (videoLength < 1) {
            throw new IllegalArgumentException("videoLength must be positive");
        }
        if (fps < 1) {
            throw new IllegalArgumentException("fps must be positive");
        }
        if (inferenceSteps < 1) {
            throw new IllegalArgumentException("inferenceSteps must be positive");
        }
    }

    public String prompt() {
        return prompt;
    }

    public String negativePrompt() {
        return negativePrompt;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int videoLength() {
        return videoLength;
    }

    public int fps() {
        return fps;
    }

    public String baseModel() {
        return baseModel;
    }

    public String motionAdapter() {
        return motionAdapter;
    }

    public Map<String, Double> loras() {
        return loras;
    }

    public int inferenceSteps() {
        return inferenceSteps;
    }

    public double guidanceScale() {
        return guidanceScale;
    }

    public long seed() {
        return seed;
    }

    public String outputFormat() {
        return outputFormat;
    }

    public Builder toBuilder() {
        return new Builder()
                .prompt(prompt)
                .negativePrompt(negativePrompt)
                .width(width)
                .height(height)
                .videoLength(videoLength)
                .fps(fps)
                .baseModel(baseModel)
                .motionAdapter(motionAdapter)
                .loras(loras)
                .inferenceSteps(inferenceSteps)
                .guidanceScale(guidanceScale)
                .seed(seed)
                .outputFormat(outputFormat);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String prompt;
        private String negativePrompt;
        private int width = 512;
        private int height = 512;
        private int videoLength = 4;
        private int fps = 8;
        private String baseModel = "sd15";
        private String motionAdapter = "default";
        private Map<String, Double> loras = Map.of();
        private int inferenceSteps = 25;
        private double guidanceScale = 7.5;
        private long seed = 0L;
        private String outputFormat = "mp4";

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder negativePrompt(String negativePrompt) {
            this.negativePrompt = negativePrompt;
            return this;
        }

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder height(int height) {
            this.height = height;
            return this;
        }

        public Builder videoLength(int videoLength) {
            this.videoLength = videoLength;
            return this;
        }

        public Builder fps(int fps) {
            this.fps = fps;
            return this;
        }

        public Builder baseModel(String baseModel) {
            this.baseModel = baseModel;
            return this;
        }

        public Builder motionAdapter(String motionAdapter) {
            this.motionAdapter = motionAdapter;
            return this;
        }

        public Builder loras(Map<String, Double> loras) {
            this.loras = loras != null ? loras : Map.of();
            return this;
        }

        public Builder inferenceSteps(int inferenceSteps) {
            this.inferenceSteps = inferenceSteps;
            return this;
        }

        public Builder guidanceScale(double guidanceScale) {
            this.guidanceScale = guidanceScale;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public GenerationSpec build() {
            return new GenerationSpec(this);
        }
    }

    @Override
    public String toString() {
        return "GenerationSpec{" + width + "x" + height +
                ", length=" + videoLength + "s" +
                ", fps=" + fps +
                ", model='" + baseModel + '\'' +
                ", steps=" + inferenceSteps +
                ", seed=" + seed +
                ", format='" + outputFormat + '\'' +
                '}';
    }
}
