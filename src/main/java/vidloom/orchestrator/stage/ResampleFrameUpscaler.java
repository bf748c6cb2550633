package vidloom.orchestrator.stage;

import vidloom.orchestrator.pipeline.JobCancelledException;
import vidloom.orchestrator.pipeline.StageContext;
import vidloom.orchestrator.worker.StageWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Enlarges every frame by the scale factor.
 *
 * Faults other than cancellation do not fail the job: the input frames are
 * returned unchanged and the error is logged.
 */
public class ResampleFrameUpscaler implements StageWorker<UpscaleRequest, FrameBatch> {

    private static final Logger log = LoggerFactory.getLogger(ResampleFrameUpscaler.class);

    private final FrameResampler resampler;

    public ResampleFrameUpscaler(FrameResampler resampler) {
        this.resampler = resampler;
    }

    @Override
    public FrameBatch process(UpscaleRequest request, StageContext context) {
        FrameBatch frames = request.frames();
        if (frames.isEmpty() || request.scaleFactor() <= 1) {
            log.info("Job {}: nothing to upscale ({} frames, scale {})",
                    context.jobId(), frames.size(), request.scaleFactor());
            return frames;
        }

        try {
            FrameBatch result = upscale(frames, request.scaleFactor(), context);
            log.info("Job {}: upscaled {} frames to {}x{}",
                    context.jobId(), result.size(), result.width(), result.height());
            return result;
        } catch (JobCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Job {}: frame upscaling failed, keeping original {}x{} frames: {}",
                    context.jobId(), frames.width(), frames.height(), e.getMessage(), e);
            return frames;
        }
    }

    private FrameBatch upscale(FrameBatch frames, int scale, StageContext context) {
        int total = frames.size();
        int midpoint = total / 2;

        List<BufferedImage> out = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            context.checkpoint("frame " + (i + 1) + "/" + total);

            BufferedImage frame = frames.get(i);
            out.add(resampler.resample(frame, frame.getWidth() * scale, frame.getHeight() * scale));

            if (i == midpoint) {
                context.reportMidpoint();
            }
        }
        return new FrameBatch(out);
    }
}
