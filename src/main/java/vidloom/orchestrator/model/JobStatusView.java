package vidloom.orchestrator.model;

/**
 * Lightweight projection of a job's progress, read on every poll.
 */
public record JobStatusView(
        String jobId,
        JobStatus status,
        int progressPercentage,
        String currentStep,
        String errorMessage) {
}
