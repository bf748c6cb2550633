package vidloom.orchestrator.pipeline;

/**
 * Reads the persisted cancellation state of the current job.
 */
@FunctionalInterface
public interface CancellationCheck {

    boolean isCancelled();
}
