package vidloom.orchestrator.pipeline;

import java.util.Objects;

/**
 * Per-invocation handle given to a stage worker: which job it works for, how to
 * check for cancellation and where to report progress.
 */
public final class StageContext {

    private final String jobId;
    private final ProgressRange progressRange;
    private final CancellationCheck cancellation;
    private final ProgressListener progress;

    public StageContext(String jobId, ProgressRange progressRange,
            CancellationCheck cancellation, ProgressListener progress) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is required");
        this.progressRange = Objects.requireNonNull(progressRange, "progressRange is required");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation is required");
        this.progress = progress != null ? progress : ProgressListener.NONE;
    }

    public String jobId() {
        return jobId;
    }

    public ProgressRange progressRange() {
        return progressRange;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Abort the stage if the job has been cancelled.
     *
     * @param where checkpoint description, used in logs
     * @throws JobCancelledException if the job is cancelled
     */
    public void checkpoint(String where) {
        if (cancellation.isCancelled()) {
            throw new JobCancelledException(jobId, where);
        }
    }

    public void reportProgress(int current, int total) {
        progress.onProgress(current, total);
    }

    /**
     * Report that the stage is half done. Maps to {@code start + width / 2}
     * of the progress window, whatever the amount of work.
     */
    public void reportMidpoint() {
        progress.onProgress(1, 3);
    }
}
