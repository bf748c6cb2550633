package vidloom.orchestrator.service;

import vidloom.orchestrator.model.BaseModel;
import vidloom.orchestrator.model.GenerationRequest;
import vidloom.orchestrator.model.GenerationSpec;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Turns a user's {@link GenerationRequest} into the {@link GenerationSpec} the
 * pipeline runs: frame size from aspect ratio and resolution class, guidance
 * scale from the base model, and a fresh random seed.
 */
public class GenerationRequestConverter {

    static final long SEED_MODULUS = 1_000_000_000L;

    private final LongSupplier seedSource;

    public GenerationRequestConverter() {
        this(() -> ThreadLocalRandom.current().nextLong(0, 1L << 32) % SEED_MODULUS);
    }

    public GenerationRequestConverter(LongSupplier seedSource) {
        this.seedSource = seedSource;
    }

    public GenerationSpec convert(GenerationRequest request) {
        String baseModel = request.baseModel().id();
        return GenerationSpec.builder()
                .prompt(request.prompt())
                .negativePrompt(request.negativePrompt() != null ? request.negativePrompt() : "")
                .width(request.resolution().widthFor(request.aspectRatio()))
                .height(request.resolution().height())
                .videoLength(request.videoLength())
                .fps(request.fps())
                .baseModel(baseModel)
                .motionAdapter(request.motionAdapter())
                .loras(Map.of())
                .inferenceSteps(request.inferenceSteps())
                .guidanceScale(BaseModel.guidanceScaleFor(baseModel))
                .seed(seedSource.getAsLong())
                .outputFormat(request.outputFormat())
                .build();
    }
}
