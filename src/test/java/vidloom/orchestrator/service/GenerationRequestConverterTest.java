package vidloom.orchestrator.service;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import vidloom.orchestrator.model.AspectRatio;
import vidloom.orchestrator.model.BaseModel;
import vidloom.orchestrator.model.GenerationRequest;
import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.model.ResolutionClass;

import static org.junit.jupiter.api.Assertions.*;

class GenerationRequestConverterTest {

    private static GenerationRequest request(AspectRatio ratio, ResolutionClass resolution) {
        return new GenerationRequest("city at night", null, ratio, resolution, 3, 16, "webm",
                BaseModel.EPIC_REALISM, null, 20);
    }

    @Test
    void convertsSizeFromRatioAndResolution() {
        GenerationSpec spec = new GenerationRequestConverter(() -> 42L)
                .convert(request(AspectRatio.LANDSCAPE_3_2, ResolutionClass.P480));

        assertEquals(720, spec.width());
        assertEquals(480, spec.height());
        assertEquals(3, spec.videoLength());
        assertEquals(16, spec.fps());
        assertEquals("epicrealism", spec.baseModel());
        assertEquals("default", spec.motionAdapter());
        assertEquals("", spec.negativePrompt());
        assertEquals(20, spec.inferenceSteps());
        assertEquals(BaseModel.DEFAULT_GUIDANCE_SCALE, spec.guidanceScale());
        assertEquals(42L, spec.seed());
        assertEquals("webm", spec.outputFormat());
        assertTrue(spec.loras().isEmpty());
    }

    @Test
    void portraitSwapsOrientation() {
        GenerationSpec spec = new GenerationRequestConverter(() -> 1L)
                .convert(request(AspectRatio.PORTRAIT_2_3, ResolutionClass.P512));

        assertEquals(342, spec.width());
        assertEquals(512, spec.height());
    }

    @RepeatedTest(20)
    void randomSeedStaysBelowModulus() {
        long seed = new GenerationRequestConverter()
                .convert(request(AspectRatio.SQUARE, ResolutionClass.P256)).seed();

        assertTrue(seed >= 0 && seed < GenerationRequestConverter.SEED_MODULUS, "seed " + seed);
    }
}
