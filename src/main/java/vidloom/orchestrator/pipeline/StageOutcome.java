package vidloom.orchestrator.pipeline;

import java.util.NoSuchElementException;

/**
 * Result of one stage invocation: either completed with a value or cancelled.
 * Faults are not outcomes; they surface as exceptions.
 */
public final class StageOutcome<T> {

    private final T value;
    private final boolean cancelled;

    private StageOutcome(T value, boolean cancelled) {
        this.value = value;
        this.cancelled = cancelled;
    }

    public static <T> StageOutcome<T> completed(T value) {
        return new StageOutcome<>(value, false);
    }

    public static <T> StageOutcome<T> cancelled() {
        return new StageOutcome<>(null, true);
    }

    /**
     * Cancelled after the work had already produced {@code discarded}. The caller
     * owns the value and releases it (e.g. deletes a written file).
     */
    public static <T> StageOutcome<T> cancelledAfter(T discarded) {
        return new StageOutcome<>(discarded, true);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws NoSuchElementException if the stage was cancelled
     */
    public T value() {
        if (cancelled) {
            throw new NoSuchElementException("Stage was cancelled, no value");
        }
        return value;
    }

    /**
     * Value produced before cancellation was noticed, or null.
     */
    public T discarded() {
        return cancelled ? value : null;
    }

    @Override
    public String toString() {
        return cancelled ? "StageOutcome{cancelled}" : "StageOutcome{completed}";
    }
}
