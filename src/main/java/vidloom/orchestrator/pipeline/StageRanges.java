package vidloom.orchestrator.pipeline;

import java.util.List;

/**
 * The five consecutive progress windows of one job, in pipeline order.
 */
public record StageRanges(
        ProgressRange preprocessing,
        ProgressRange generation,
        ProgressRange interpolation,
        ProgressRange upscaling,
        ProgressRange saving) {

    public List<ProgressRange> all() {
        return List.of(preprocessing, generation, interpolation, upscaling, saving);
    }

    @Override
    public String toString() {
        return "preprocessing=" + preprocessing +
                " generation=" + generation +
                " interpolation=" + interpolation +
                " upscaling=" + upscaling +
                " saving=" + saving;
    }
}
