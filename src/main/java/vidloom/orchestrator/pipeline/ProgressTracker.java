package vidloom.orchestrator.pipeline;

import vidloom.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a stage's relative progress into its absolute window and persists it.
 *
 * A value is written only when it is higher than the last written one, or when
 * it is the final unit of the stage. Written values never decrease.
 */
public final class ProgressTracker implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final JobRepository jobRepository;
    private final String jobId;
    private final ProgressRange range;
    private final String stepLabel;

    private int lastWritten = -1;

    public ProgressTracker(JobRepository jobRepository, String jobId, ProgressRange range, String stepLabel) {
        this.jobRepository = jobRepository;
        this.jobId = jobId;
        this.range = range;
        this.stepLabel = stepLabel;
    }

    @Override
    public synchronized void onProgress(int current, int total) {
        int progress = range.map(current, total);
        boolean finalUnit = current >= total - 1;

        if (progress <= lastWritten && !finalUnit) {
            return;
        }

        int value = Math.max(progress, lastWritten);
        String step = stepLabel + " (" + (current + 1) + "/" + total + ")";
        try {
            jobRepository.setProgress(jobId, value, step);
            lastWritten = value;
        } catch (RuntimeException e) {
            log.warn("Failed to record progress {} for job {}: {}", value, jobId, e.getMessage());
        }
    }

    /** Last value written to the store, or -1 if none yet. */
    public synchronized int lastWritten() {
        return lastWritten;
    }
}
