package vidloom.orchestrator.stage;

import vidloom.orchestrator.pipeline.StageContext;
import vidloom.orchestrator.worker.StageWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plans generation: how many frames per second and what resolution the core
 * generator renders, and the factors interpolation and upscaling must apply.
 */
public class VideoPreprocessor implements StageWorker<PreprocessRequest, PreprocessResult> {

    private static final Logger log = LoggerFactory.getLogger(VideoPreprocessor.class);

    private final PreprocessorSettings settings;

    public VideoPreprocessor(PreprocessorSettings settings) {
        this.settings = settings;
    }

    @Override
    public PreprocessResult process(PreprocessRequest request, StageContext context) {
        if (request.width() < 1 || request.height() < 1) {
            throw new IllegalArgumentException(
                    "Invalid target dimensions " + request.width() + "x" + request.height());
        }
        if (request.videoLength() < 1 || request.targetFps() < 1) {
            throw new IllegalArgumentException("Video length and fps must be positive");
        }

        int fpsFactor = fpsFactor(request.targetFps());
        int scaleFactor = scaleFactor(request.width(), request.height());

        int width = alignDimension(request.width() / scaleFactor);
        int height = alignDimension(request.height() / scaleFactor);
        int length = fpsFactor > 1
                ? request.videoLength() + settings.extraGenerationSeconds()
                : request.videoLength();

        log.info("Job {}: {}x{} @ {}fps for {}s -> generate {}x{} for {}s (fps x{}, scale x{})",
                context.jobId(), request.width(), request.height(), request.targetFps(), request.videoLength(),
                width, height, length, fpsFactor, scaleFactor);

        return new PreprocessResult(fpsFactor, scaleFactor, width, height, length);
    }

    int fpsFactor(int targetFps) {
        if (targetFps <= settings.baseFps()) {
            return 1;
        }
        return Math.max(1, targetFps / settings.baseFps());
    }

    int scaleFactor(int width, int height) {
        int maxDim = Math.max(width, height);
        if (maxDim <= settings.maxGenerationDimension()) {
            return 1;
        }
        int ratio = (int) Math.ceil((double) maxDim / settings.maxGenerationDimension());
        return roundToPowerOfTwo(ratio);
    }

    /**
     * Nearest power of two; a value exactly between two powers rounds up.
     */
    static int roundToPowerOfTwo(int n) {
        if (n <= 1) {
            return 1;
        }
        int power = 1;
        while (power * 2 < n) {
            power *= 2;
        }
        return (n - power) < (power * 2 - n) ? power : power * 2;
    }

    private int alignDimension(int scaled) {
        int aligned = (scaled / settings.dimensionAlignment()) * settings.dimensionAlignment();
        return Math.max(settings.minDimension(), aligned);
    }
}
