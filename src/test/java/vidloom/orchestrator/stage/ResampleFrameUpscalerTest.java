package vidloom.orchestrator.stage;

import org.junit.jupiter.api.Test;
import vidloom.orchestrator.pipeline.JobCancelledException;
import vidloom.orchestrator.pipeline.ProgressRange;
import vidloom.orchestrator.pipeline.ProgressTracker;
import vidloom.orchestrator.pipeline.StageContext;
import vidloom.orchestrator.support.InMemoryJobRepository;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static vidloom.orchestrator.stage.BlendFrameInterpolatorTest.solid;

class ResampleFrameUpscalerTest {

    @Test
    void enlargesEveryFrame() {
        FrameBatch frames = new FrameBatch(List.of(solid(16, 8, 0x336699), solid(16, 8, 0x336699)));
        AtomicInteger reports = new AtomicInteger();
        StageContext context = new StageContext("job-1", new ProgressRange(85, 99), () -> false,
                (current, total) -> reports.incrementAndGet());

        FrameBatch result = new ResampleFrameUpscaler(new BicubicFrameResampler())
                .process(new UpscaleRequest(frames, 2), context);

        assertEquals(2, result.size());
        assertEquals(32, result.width());
        assertEquals(16, result.height());
        assertEquals(1, reports.get());
    }

    @Test
    void midpointReportLandsInTheMiddleOfTheWindow() {
        InMemoryJobRepository repo = new InMemoryJobRepository();
        repo.putProcessing("job-1");
        ProgressRange window = new ProgressRange(85, 99);
        StageContext context = new StageContext("job-1", window, () -> false,
                new ProgressTracker(repo, "job-1", window, "Upscaling frames"));
        FrameBatch frames = new FrameBatch(List.of(solid(4, 4, 0x336699), solid(4, 4, 0x336699)));

        new ResampleFrameUpscaler(new BicubicFrameResampler()).process(new UpscaleRequest(frames, 2), context);

        assertEquals(List.of(92), repo.progressValues("job-1"));
    }

    @Test
    void scaleOfOneIsNoop() {
        FrameBatch frames = new FrameBatch(List.of(solid(4, 4, 0)));
        StageContext context = new StageContext("job-1", new ProgressRange(85, 99), () -> false, null);

        assertSame(frames, new ResampleFrameUpscaler(new BicubicFrameResampler())
                .process(new UpscaleRequest(frames, 1), context));
    }

    @Test
    void resampleFailureKeepsOriginalFrames() {
        FrameBatch frames = new FrameBatch(List.of(solid(4, 4, 0)));
        StageContext context = new StageContext("job-1", new ProgressRange(85, 99), () -> false, null);
        FrameResampler broken = (frame, width, height) -> {
            throw new IllegalStateException("no memory for " + width + "x" + height);
        };

        FrameBatch result = new ResampleFrameUpscaler(broken).process(new UpscaleRequest(frames, 4), context);

        assertSame(frames, result);
        assertEquals(4, result.width());
    }

    @Test
    void cancellationIsNotSwallowed() {
        FrameBatch frames = new FrameBatch(List.of(solid(4, 4, 0)));
        StageContext context = new StageContext("job-1", new ProgressRange(85, 99), () -> true, null);

        assertThrows(JobCancelledException.class, () -> new ResampleFrameUpscaler(new BicubicFrameResampler())
                .process(new UpscaleRequest(frames, 2), context));
    }
}
