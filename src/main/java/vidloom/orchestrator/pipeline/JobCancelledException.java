package vidloom.orchestrator.pipeline;

/**
 * Raised at a stage checkpoint when the job has been cancelled.
 * Caught by {@link CancellableExecutor} and turned into {@link StageOutcome#cancelled()}.
 */
public class JobCancelledException extends RuntimeException {

    private final String jobId;

    public JobCancelledException(String jobId, String checkpoint) {
        super("Job " + jobId + " cancelled at " + checkpoint);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
