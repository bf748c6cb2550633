package vidloom.orchestrator.pipeline;

/**
 * Half-open progress window {@code [start, end)} a stage's progress maps into.
 */
public record ProgressRange(int start, int end) {

    public ProgressRange {
        if (start < 0 || end > 100 || start > end) {
            throw new IllegalArgumentException("Invalid progress range [" + start + ", " + end + ")");
        }
    }

    public int width() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Absolute progress for {@code current} out of {@code total} units of work,
     * floored and clamped to {@code [start, end]}. The last unit
     * ({@code total - 1}) maps to {@code end}.
     */
    public int map(int current, int total) {
        double fraction = total > 1 ? (double) current / (total - 1) : 1.0;
        int progress = start + (int) Math.floor(fraction * width());
        return Math.max(start, Math.min(end, progress));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
