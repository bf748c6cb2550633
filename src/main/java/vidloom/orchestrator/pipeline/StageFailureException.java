package vidloom.orchestrator.pipeline;

/**
 * A stage faulted with a checked exception.
 */
public class StageFailureException extends RuntimeException {

    public StageFailureException(StageKind kind, Throwable cause) {
        super(kind.operation() + " failed: " + cause.getMessage(), cause);
    }
}
