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
 * Raises the frame rate by inserting {@code factor - 1} blended frames between
 * each pair of neighbours.
 *
 * Faults other than cancellation do not fail the job: the input frames are
 * returned unchanged and the error is logged.
 */
public class BlendFrameInterpolator implements StageWorker<InterpolateRequest, FrameBatch> {

    private static final Logger log = LoggerFactory.getLogger(BlendFrameInterpolator.class);

    private final FrameBlender blender;

    public BlendFrameInterpolator(FrameBlender blender) {
        this.blender = blender;
    }

    @Override
    public FrameBatch process(InterpolateRequest request, StageContext context) {
        FrameBatch frames = request.frames();
        if (frames.size() < 2 || request.factor() < 2) {
            log.info("Job {}: nothing to interpolate ({} frames, factor {})",
                    context.jobId(), frames.size(), request.factor());
            return frames;
        }

        try {
            FrameBatch result = interpolate(frames, request.factor(), context);
            log.info("Job {}: interpolated {} -> {} frames", context.jobId(), frames.size(), result.size());
            return result;
        } catch (JobCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Job {}: frame interpolation failed, keeping {} original frames: {}",
                    context.jobId(), frames.size(), e.getMessage(), e);
            return frames;
        }
    }

    private FrameBatch interpolate(FrameBatch frames, int factor, StageContext context) {
        int pairs = frames.size() - 1;
        int midpoint = pairs / 2;

        List<BufferedImage> out = new ArrayList<>(pairs * factor + 1);
        out.add(frames.get(0));

        for (int i = 0; i < pairs; i++) {
            context.checkpoint("frame pair " + (i + 1) + "/" + pairs);

            BufferedImage from = frames.get(i);
            BufferedImage to = frames.get(i + 1);
            for (int j = 1; j < factor; j++) {
                out.add(blender.blend(from, to, (double) j / factor));
            }
            out.add(to);

            if (i == midpoint) {
                context.reportMidpoint();
            }
        }
        return new FrameBatch(out);
    }
}
