package vidloom.orchestrator.repository;

import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.model.JobResult;
import vidloom.orchestrator.model.JobStatus;
import vidloom.orchestrator.model.JobStatusView;

import java.util.List;
import java.util.Optional;

/**
 * Persisted job state. This is the single source of truth for job status,
 * progress and cancellation: stage workers poll it at their checkpoints.
 *
 * All state changes are conditional single-row updates, so no method can move
 * a job out of a terminal status.
 */
public interface JobRepository {

    /**
     * Create a new PENDING job together with its generation parameters.
     *
     * @param spec    generation parameters
     * @param ownerId optional owner, may be null
     * @return the created job
     */
    Job createJob(GenerationSpec spec, String ownerId);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Status, progress and step of a job.
     *
     * @param jobId the job ID
     * @return the view if the job exists
     */
    Optional<JobStatusView> getStatus(String jobId);

    /**
     * Generation parameters stored at creation.
     */
    Optional<GenerationSpec> findParameters(String jobId);

    /**
     * Artifact location of a completed job.
     */
    Optional<JobResult> findResult(String jobId);

    /**
     * Get recent jobs ordered by creation time.
     *
     * @param limit maximum results
     * @return list of jobs
     */
    List<Job> findRecent(int limit);

    /**
     * Terminal jobs of an owner that have not been marked as read.
     */
    List<Job> findUnread(String ownerId);

    /**
     * Move a job from {@code from} to {@code to}. Sets started_at when entering
     * PROCESSING and completed_at when entering a terminal status.
     *
     * @return true if the job was in {@code from} and has been moved
     * @throws IllegalArgumentException if the transition is not allowed by the state machine
     */
    boolean transitionStatus(String jobId, JobStatus from, JobStatus to);

    /**
     * Record progress of a PROCESSING job. Progress never decreases.
     *
     * @param percentage 0..100
     * @param step       human readable step description
     * @return true if the job is PROCESSING and the row was updated
     */
    boolean setProgress(String jobId, int percentage, String step);

    /**
     * Attach an error message to a PROCESSING job.
     */
    boolean setError(String jobId, String message);

    /**
     * Move a PROCESSING job to FAILED and record the error in one update.
     */
    boolean markFailed(String jobId, String message);

    /**
     * Record where the artifact of a PROCESSING job was stored.
     */
    boolean saveResult(String jobId, String objectKey, String bucket, long sizeBytes);

    /**
     * Flip a PENDING or PROCESSING job to CANCELLED.
     *
     * @return false for unknown or terminal jobs
     */
    boolean requestCancel(String jobId);

    /**
     * @return true if the job exists and is CANCELLED
     */
    boolean isCancelled(String jobId);

    /**
     * @return true if the job exists and is COMPLETED
     */
    boolean isCompleted(String jobId);

    /**
     * Mark a job as read by its owner.
     *
     * @return true if the job exists
     */
    boolean markAsRead(String jobId);
}
