package vidloom.orchestrator.worker;

import vidloom.orchestrator.pipeline.ProgressRange;
import vidloom.orchestrator.pipeline.StageKind;
import vidloom.orchestrator.pipeline.StageOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Logical endpoint of one stage kind, backed by a set of worker replicas.
 */
public interface WorkerPool<I, O> extends AutoCloseable {

    StageKind kind();

    /**
     * Run {@code request} for {@code jobId} on one replica.
     *
     * @param window absolute progress window the stage reports into
     * @return future completing with the stage outcome, or exceptionally with the stage fault
     */
    CompletableFuture<StageOutcome<O>> execute(I request, String jobId, ProgressRange window);

    default CompletableFuture<StageOutcome<O>> execute(I request, String jobId, int progressStart, int progressEnd) {
        return execute(request, jobId, new ProgressRange(progressStart, progressEnd));
    }

    PoolStats stats();

    /**
     * Retire replicas that have been idle longer than the pool's downscale delay,
     * never going below the minimum replica count.
     *
     * @return number of replicas retired
     */
    int retireIdle();

    @Override
    void close();
}
