package vidloom.orchestrator.service;

import vidloom.orchestrator.model.GenerationRequest;
import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.model.JobResult;
import vidloom.orchestrator.model.JobStatus;
import vidloom.orchestrator.model.JobStatusView;
import vidloom.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Business logic for job management: creation and dispatch, cancellation,
 * status lookups and read tracking.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final JobDispatcher dispatcher;
    private final GenerationRequestConverter converter;

    public JobService(JobRepository jobRepository, JobDispatcher dispatcher, GenerationRequestConverter converter) {
        this.jobRepository = jobRepository;
        this.dispatcher = dispatcher;
        this.converter = converter;
    }

    /**
     * Create a job from a user request and start its pipeline in the background.
     *
     * @return the created PENDING job
     */
    public Job submit(GenerationRequest request, String ownerId) {
        GenerationSpec spec = converter.convert(request);
        Job job = createJob(spec, ownerId);
        dispatcher.dispatch(spec, job.id()).whenComplete((ignored, error) -> {
            if (error != null) {
                failUndispatched(job.id(), error);
            }
        });
        return job;
    }

    // A job the dispatcher refused would otherwise stay PENDING forever
    private void failUndispatched(String jobId, Throwable error) {
        log.error("Job {} could not be dispatched: {}", jobId, error.toString());
        try {
            if (jobRepository.transitionStatus(jobId, JobStatus.PENDING, JobStatus.PROCESSING)) {
                jobRepository.markFailed(jobId, "Job could not be dispatched: " + error.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Could not mark undispatched job {} as failed", jobId, e);
        }
    }

    /**
     * Create a PENDING job without dispatching it.
     */
    public Job createJob(GenerationSpec spec, String ownerId) {
        Job job = jobRepository.createJob(spec, ownerId);
        log.info("Created job {} '{}'", job.id(), job.name());
        return job;
    }

    /**
     * Request cancellation. Running stages notice it at their next checkpoint.
     *
     * @return false if the job is unknown or already terminal
     */
    public boolean cancel(String jobId) {
        boolean cancelled = jobRepository.requestCancel(jobId);
        if (cancelled) {
            log.info("Cancellation requested for job {}", jobId);
        } else {
            log.debug("Job {} not cancellable", jobId);
        }
        return cancelled;
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> findRecent(int limit) {
        return jobRepository.findRecent(limit);
    }

    public List<Job> findUnread(String ownerId) {
        return jobRepository.findUnread(ownerId);
    }

    public boolean markAsRead(String jobId) {
        return jobRepository.markAsRead(jobId);
    }

    public Optional<JobStatusView> getStatus(String jobId) {
        return jobRepository.getStatus(jobId);
    }

    public Optional<JobResult> findResult(String jobId) {
        return jobRepository.findResult(jobId);
    }

    public Optional<GenerationSpec> findParameters(String jobId) {
        return jobRepository.findParameters(jobId);
    }
}
