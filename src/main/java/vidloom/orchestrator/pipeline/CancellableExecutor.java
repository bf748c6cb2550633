package vidloom.orchestrator.pipeline;

import vidloom.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brackets one unit of stage work with cancellation checks and tracks which
 * job the owning replica is working on.
 *
 * Cancellation is read from the job store on every check. A failed read is
 * logged and treated as "not cancelled" so a store hiccup does not abort work.
 */
public final class CancellableExecutor {

    private static final Logger log = LoggerFactory.getLogger(CancellableExecutor.class);

    /**
     * Stage work that may poll for cancellation while it runs.
     */
    @FunctionalInterface
    public interface CancellableOperation<T> {
        T run(CancellationCheck cancellation) throws Exception;
    }

    private final String replicaId;
    private final JobRepository jobRepository;

    private volatile String currentJobId;

    public CancellableExecutor(String replicaId, JobRepository jobRepository) {
        this.replicaId = replicaId;
        this.jobRepository = jobRepository;
    }

    /**
     * Run {@code operation} for {@code jobId}.
     *
     * @return completed with the operation's value, or cancelled if the job was
     *         cancelled before, during or right after the work
     * @throws RuntimeException any fault of the operation; checked exceptions
     *                          are wrapped in {@link StageFailureException}
     */
    public <T> StageOutcome<T> execute(String jobId, StageKind kind, CancellableOperation<T> operation) {
        currentJobId = jobId;
        log.info("Replica {} starting {} for job {}", replicaId, kind.operation(), jobId);
        try {
            if (isCancelled(jobId)) {
                log.info("Job {} already cancelled, skipping {}", jobId, kind.operation());
                return StageOutcome.cancelled();
            }

            T result = operation.run(() -> isCancelled(jobId));

            if (isCancelled(jobId)) {
                log.info("Job {} cancelled after {} finished, discarding result", jobId, kind.operation());
                return StageOutcome.cancelledAfter(result);
            }

            log.info("Replica {} completed {} for job {}", replicaId, kind.operation(), jobId);
            return StageOutcome.completed(result);
        } catch (JobCancelledException e) {
            log.info("Replica {} stopped {}: {}", replicaId, kind.operation(), e.getMessage());
            return StageOutcome.cancelled();
        } catch (RuntimeException e) {
            log.error("Replica {} failed {} for job {}: {}", replicaId, kind.operation(), jobId, e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            log.error("Replica {} failed {} for job {}: {}", replicaId, kind.operation(), jobId, e.getMessage(), e);
            throw new StageFailureException(kind, e);
        } finally {
            currentJobId = null;
        }
    }

    /**
     * Read the cancellation flag of {@code jobId} from the store.
     */
    public boolean isCancelled(String jobId) {
        try {
            return jobRepository.isCancelled(jobId);
        } catch (RuntimeException e) {
            log.warn("Replica {} could not read cancellation state of job {}: {}",
                    replicaId, jobId, e.getMessage());
            return false;
        }
    }

    public String replicaId() {
        return replicaId;
    }

    /** Job the replica is working on, or null when idle. */
    public String currentJobId() {
        return currentJobId;
    }
}
