package vidloom.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a generation job.
 */
public enum JobStatus {
    /** Job created, pipeline not started yet */
    PENDING,
    /** Pipeline is running stages */
    PROCESSING,
    /** Artifact uploaded and result recorded */
    COMPLETED,
    /** A stage faulted and the job was not cancelled */
    FAILED,
    /** Cancelled by an external request */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Statuses a job may move to this status from.
     */
    public Set<JobStatus> predecessors() {
        return switch (this) {
            case PENDING -> EnumSet.noneOf(JobStatus.class);
            case PROCESSING -> EnumSet.of(PENDING);
            case COMPLETED, FAILED -> EnumSet.of(PROCESSING);
            case CANCELLED -> EnumSet.of(PENDING, PROCESSING);
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return next.predecessors().contains(this);
    }
}
