package vidloom.orchestrator.pipeline;

/**
 * Percentage budget per stage. Budgets are non-negative and sum to exactly 100.
 */
public record ProgressBudgets(
        int preprocessing,
        int generation,
        int interpolation,
        int upscaling,
        int saving) {

    public ProgressBudgets {
        if (preprocessing < 0 || generation < 0 || interpolation < 0 || upscaling < 0 || saving < 0) {
            throw new IllegalArgumentException("Progress budgets must be non-negative");
        }
        int total = preprocessing + generation + interpolation + upscaling + saving;
        if (total != 100) {
            throw new IllegalArgumentException("Progress budgets must sum to 100, got " + total);
        }
    }

    public static ProgressBudgets defaults() {
        return new ProgressBudgets(1, 70, 14, 14, 1);
    }
}
