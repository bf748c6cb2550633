package vidloom.orchestrator.stage;

import org.junit.jupiter.api.Test;
import vidloom.orchestrator.pipeline.JobCancelledException;
import vidloom.orchestrator.pipeline.ProgressRange;
import vidloom.orchestrator.pipeline.ProgressTracker;
import vidloom.orchestrator.pipeline.StageContext;
import vidloom.orchestrator.support.InMemoryJobRepository;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlendFrameInterpolatorTest {

    static BufferedImage solid(int width, int height, int rgb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    private static StageContext context(List<int[]> reports) {
        return new StageContext("job-1", new ProgressRange(71, 85), () -> false,
                (current, total) -> reports.add(new int[] {current, total}));
    }

    @Test
    void insertsBlendedFrames() {
        FrameBatch frames = new FrameBatch(List.of(solid(4, 4, 0x000000), solid(4, 4, 0xFFFFFF), solid(4, 4, 0x000000)));
        List<int[]> reports = new ArrayList<>();

        FrameBatch result = new BlendFrameInterpolator(new LinearFrameBlender())
                .process(new InterpolateRequest(frames, 2), context(reports));

        assertEquals(5, result.size());
        assertSame(frames.get(0), result.get(0));
        assertSame(frames.get(1), result.get(2));
        assertEquals(0x808080, result.get(1).getRGB(1, 1) & 0xFFFFFF);
        assertEquals(1, reports.size());
    }

    @Test
    void midpointReportLandsInTheMiddleOfTheWindow() {
        InMemoryJobRepository repo = new InMemoryJobRepository();
        repo.putProcessing("job-1");
        ProgressRange window = new ProgressRange(71, 85);
        StageContext context = new StageContext("job-1", window, () -> false,
                new ProgressTracker(repo, "job-1", window, "Interpolating frames"));
        FrameBatch frames = new FrameBatch(List.of(solid(4, 4, 0), solid(4, 4, 0xFFFFFF), solid(4, 4, 0)));

        new BlendFrameInterpolator(new LinearFrameBlender()).process(new InterpolateRequest(frames, 2), context);

        assertEquals(List.of(78), repo.progressValues("job-1"));
    }

    @Test
    void midpointDoesNotDependOnBatchSize() {
        InMemoryJobRepository repo = new InMemoryJobRepository();
        repo.putProcessing("job-1");
        ProgressRange window = new ProgressRange(71, 85);
        StageContext context = new StageContext("job-1", window, () -> false,
                new ProgressTracker(repo, "job-1", window, "Interpolating frames"));
        List<BufferedImage> input = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            input.add(solid(2, 2, i * 0x101010));
        }

        new BlendFrameInterpolator(new LinearFrameBlender())
                .process(new InterpolateRequest(new FrameBatch(input), 2), context);

        assertEquals(List.of(78), repo.progressValues("job-1"));
    }

    @Test
    void frameCountGrowsByFactor() {
        List<BufferedImage> input = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            input.add(solid(2, 2, i * 0x101010));
        }

        FrameBatch result = new BlendFrameInterpolator(new LinearFrameBlender())
                .process(new InterpolateRequest(new FrameBatch(input), 4), context(new ArrayList<>()));

        assertEquals(8 * 4 + 1, result.size());
    }

    @Test
    void singleFrameIsReturnedAsIs() {
        FrameBatch frames = new FrameBatch(List.of(solid(2, 2, 0)));

        FrameBatch result = new BlendFrameInterpolator(new LinearFrameBlender())
                .process(new InterpolateRequest(frames, 2), context(new ArrayList<>()));

        assertSame(frames, result);
    }

    @Test
    void blendFailureKeepsOriginalFrames() {
        FrameBatch frames = new FrameBatch(List.of(solid(2, 2, 0), solid(2, 2, 0xFFFFFF)));
        FrameBlender broken = (from, to, t) -> {
            throw new IllegalStateException("model not loaded");
        };

        FrameBatch result = new BlendFrameInterpolator(broken)
                .process(new InterpolateRequest(frames, 2), context(new ArrayList<>()));

        assertSame(frames, result);
    }

    @Test
    void cancellationIsNotSwallowed() {
        FrameBatch frames = new FrameBatch(List.of(solid(2, 2, 0), solid(2, 2, 0xFFFFFF)));
        StageContext cancelled = new StageContext("job-1", new ProgressRange(71, 85), () -> true, null);

        assertThrows(JobCancelledException.class, () -> new BlendFrameInterpolator(new LinearFrameBlender())
                .process(new InterpolateRequest(frames, 2), cancelled));
    }
}
