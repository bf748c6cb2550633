package vidloom.orchestrator.stage;

import org.junit.jupiter.api.Test;
import vidloom.orchestrator.pipeline.JobCancelledException;
import vidloom.orchestrator.pipeline.ProgressRange;
import vidloom.orchestrator.pipeline.StageContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SeededFrameGeneratorTest {

    private static GenerateRequest request(String model, long seed) {
        return new GenerateRequest("a red fox in snow", "", 32, 16, 1, 4, 3, 7.5, seed, model, null, Map.of());
    }

    private static StageContext quiet() {
        return new StageContext("job-1", new ProgressRange(1, 71), () -> false, null);
    }

    @Test
    void producesOneFramePerSecondAndFps() {
        FrameBatch frames = new SeededFrameGenerator().process(request("sd15", 42), quiet());

        assertEquals(4, frames.size());
        assertEquals(32, frames.width());
        assertEquals(16, frames.height());
    }

    @Test
    void sameSeedSameFrames() {
        FrameBatch first = new SeededFrameGenerator().process(request("sd15", 42), quiet());
        FrameBatch second = new SeededFrameGenerator().process(request("sd15", 42), quiet());

        for (int i = 0; i < first.size(); i++) {
            assertArrayEquals(
                    first.get(i).getRGB(0, 0, 32, 16, null, 0, 32),
                    second.get(i).getRGB(0, 0, 32, 16, null, 0, 32));
        }
    }

    @Test
    void reportsEveryDenoisingStep() {
        List<Integer> steps = new ArrayList<>();
        StageContext context = new StageContext("job-1", new ProgressRange(1, 71), () -> false,
                (current, total) -> steps.add(current));

        new SeededFrameGenerator().process(request("dreamshaper", 7), context);

        assertEquals(List.of(0, 1, 2), steps);
    }

    @Test
    void unknownModelRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new SeededFrameGenerator().process(request("sdxl-turbo", 1), quiet()));
        assertTrue(e.getMessage().startsWith("Invalid base_model: sdxl-turbo"));
    }

    @Test
    void stopsAtFirstStepAfterCancellation() {
        AtomicInteger checks = new AtomicInteger();
        List<Integer> steps = new ArrayList<>();
        StageContext context = new StageContext("job-1", new ProgressRange(1, 71),
                () -> checks.incrementAndGet() > 1, (current, total) -> steps.add(current));

        assertThrows(JobCancelledException.class,
                () -> new SeededFrameGenerator().process(request("sd15", 42), context));
        assertEquals(List.of(0), steps);
    }
}
