package vidloom.orchestrator.stage;

import vidloom.orchestrator.model.BaseModel;
import vidloom.orchestrator.pipeline.StageContext;
import vidloom.orchestrator.worker.StageWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Reference core generator. Starts every frame from seeded noise in a latent
 * grid 8x smaller than the output, moves it towards a prompt-derived animated
 * pattern over {@code inferenceSteps} denoising steps, then decodes the latents
 * to full-size frames.
 *
 * Output is deterministic for a given prompt, seed and size. Cancellation is
 * checked before every denoising step.
 */
public class SeededFrameGenerator implements StageWorker<GenerateRequest, FrameBatch> {

    private static final Logger log = LoggerFactory.getLogger(SeededFrameGenerator.class);

    private static final int LATENT_DOWNSCALE = 8;
    private static final int CHANNELS = 3;

    @Override
    public FrameBatch process(GenerateRequest request, StageContext context) {
        if (!BaseModel.isKnown(request.baseModel())) {
            throw new IllegalArgumentException(
                    "Invalid base_model: " + request.baseModel() + ". Available: " + BaseModel.ids());
        }
        int frameCount = request.frameCount();
        if (frameCount < 1) {
            throw new IllegalArgumentException("Nothing to generate: " + request.videoLength() + "s at "
                    + request.fps() + "fps");
        }

        int latentWidth = Math.max(1, request.width() / LATENT_DOWNSCALE);
        int latentHeight = Math.max(1, request.height() / LATENT_DOWNSCALE);
        int latentSize = latentWidth * latentHeight * CHANNELS;

        log.info("Job {}: generating {} frames at {}x{} with {} steps (model={}, seed={})",
                context.jobId(), frameCount, request.width(), request.height(),
                request.inferenceSteps(), request.baseModel(), request.seed());

        Random noise = new Random(request.seed());
        float[][] latents = new float[frameCount][latentSize];
        float[][] targets = new float[frameCount][];
        for (int f = 0; f < frameCount; f++) {
            for (int i = 0; i < latentSize; i++) {
                latents[f][i] = noise.nextFloat();
            }
            targets[f] = targetPattern(request, f, frameCount, latentWidth, latentHeight);
        }

        int steps = request.inferenceSteps();
        for (int step = 0; step < steps; step++) {
            context.checkpoint("denoising step " + (step + 1) + "/" + steps);

            // Reaches the target exactly on the last step
            float alpha = 1f / (steps - step);
            for (int f = 0; f < frameCount; f++) {
                float[] latent = latents[f];
                float[] target = targets[f];
                for (int i = 0; i < latentSize; i++) {
                    latent[i] += (target[i] - latent[i]) * alpha;
                }
            }

            context.reportProgress(step, steps);
        }

        List<BufferedImage> frames = new ArrayList<>(frameCount);
        for (float[] latent : latents) {
            frames.add(decode(latent, latentWidth, latentHeight, request.width(), request.height()));
        }
        return new FrameBatch(frames);
    }

    private float[] targetPattern(GenerateRequest request, int frame, int frameCount, int width, int height) {
        long promptHash = request.prompt().hashCode() * 31L + request.seed();
        Random shape = new Random(promptHash);
        double freqX = 0.5 + shape.nextDouble() * 2.0;
        double freqY = 0.5 + shape.nextDouble() * 2.0;
        double[] phases = {shape.nextDouble() * Math.PI * 2, shape.nextDouble() * Math.PI * 2,
                shape.nextDouble() * Math.PI * 2};
        double contrast = Math.min(1.0, request.guidanceScale() / BaseModel.DEFAULT_GUIDANCE_SCALE);
        double time = 2 * Math.PI * frame / Math.max(1, frameCount);

        float[] target = new float[width * height * CHANNELS];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double u = (double) x / width;
                double v = (double) y / height;
                int base = (y * width + x) * CHANNELS;
                for (int c = 0; c < CHANNELS; c++) {
                    double wave = Math.sin(2 * Math.PI * (u * freqX + v * freqY) + phases[c] + time);
                    target[base + c] = (float) (0.5 + 0.5 * contrast * wave);
                }
            }
        }
        return target;
    }

    private BufferedImage decode(float[] latent, int latentWidth, int latentHeight, int width, int height) {
        BufferedImage small = new BufferedImage(latentWidth, latentHeight, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < latentHeight; y++) {
            for (int x = 0; x < latentWidth; x++) {
                int base = (y * latentWidth + x) * CHANNELS;
                int r = toByte(latent[base]);
                int g = toByte(latent[base + 1]);
                int b = toByte(latent[base + 2]);
                small.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return FrameImages.scale(small, width, height, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
    }

    private static int toByte(float value) {
        return Math.max(0, Math.min(255, Math.round(value * 255f)));
    }
}
