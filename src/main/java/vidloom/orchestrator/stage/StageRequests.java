package vidloom.orchestrator.stage;

import vidloom.orchestrator.model.GenerationSpec;

import java.nio.file.Path;

/**
 * Builds per-stage requests from a job's {@link GenerationSpec}.
 */
public final class StageRequests {

    private StageRequests() {
    }

    public static PreprocessRequest toPreprocessRequest(GenerationSpec spec) {
        return new PreprocessRequest(spec.width(), spec.height(), spec.videoLength(), spec.fps());
    }

    /**
     * Generation runs at the planned (reduced) resolution and length, at base fps.
     */
    public static GenerateRequest toGenerateRequest(GenerationSpec spec, PreprocessResult plan, int baseFps) {
        return new GenerateRequest(
                spec.prompt(),
                spec.negativePrompt(),
                plan.generationWidth(),
                plan.generationHeight(),
                plan.generationLength(),
                baseFps,
                spec.inferenceSteps(),
                spec.guidanceScale(),
                spec.seed(),
                spec.baseModel(),
                spec.motionAdapter(),
                spec.loras());
    }

    public static InterpolateRequest toInterpolateRequest(FrameBatch frames, PreprocessResult plan) {
        return new InterpolateRequest(frames, plan.fpsFactor());
    }

    public static UpscaleRequest toUpscaleRequest(FrameBatch frames, PreprocessResult plan) {
        return new UpscaleRequest(frames, plan.scaleFactor());
    }

    public static PostprocessRequest toPostprocessRequest(
            FrameBatch frames, GenerationSpec spec, int finalFps, Path outputDir) {
        return new PostprocessRequest(
                frames,
                spec.videoLength(),
                finalFps,
                spec.width(),
                spec.height(),
                spec.prompt(),
                spec.seed(),
                spec.outputFormat(),
                outputDir);
    }
}
