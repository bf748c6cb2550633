package vidloom.orchestrator.pipeline;

/**
 * Splits {@code [0, 100]} into per-stage progress windows.
 *
 * A skipped optional stage gets a zero-width window and its budget is added to
 * generation, so the windows always partition the whole bar.
 */
public final class ProgressAllocator {

    private final ProgressBudgets budgets;

    public ProgressAllocator(ProgressBudgets budgets) {
        this.budgets = budgets;
    }

    public ProgressBudgets budgets() {
        return budgets;
    }

    /** Window of the preprocessing stage, which never depends on the plan. */
    public ProgressRange preprocessingRange() {
        return new ProgressRange(0, budgets.preprocessing());
    }

    public StageRanges allocate(boolean needsInterpolation, boolean needsUpscaling) {
        return allocate(budgets, needsInterpolation, needsUpscaling);
    }

    public static StageRanges allocate(ProgressBudgets budgets, boolean needsInterpolation, boolean needsUpscaling) {
        int generation = budgets.generation();
        int interpolation = budgets.interpolation();
        int upscaling = budgets.upscaling();

        if (!needsInterpolation) {
            generation += interpolation;
            interpolation = 0;
        }
        if (!needsUpscaling) {
            generation += upscaling;
            upscaling = 0;
        }

        int generationStart = budgets.preprocessing();
        int interpolationStart = generationStart + generation;
        int upscalingStart = interpolationStart + interpolation;
        int savingStart = upscalingStart + upscaling;

        return new StageRanges(
                new ProgressRange(0, generationStart),
                new ProgressRange(generationStart, interpolationStart),
                new ProgressRange(interpolationStart, upscalingStart),
                new ProgressRange(upscalingStart, savingStart),
                new ProgressRange(savingStart, savingStart + budgets.saving()));
    }
}
