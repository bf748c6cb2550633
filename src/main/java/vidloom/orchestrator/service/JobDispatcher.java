package vidloom.orchestrator.service;

import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one pipeline per job on a bounded executor. Callers get a future they
 * may ignore; jobs beyond the concurrency limit wait in submission order.
 */
public class JobDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final PipelineOrchestrator orchestrator;
    private final ExecutorService executor;
    private final AtomicInteger threadSeq = new AtomicInteger();

    public JobDispatcher(PipelineOrchestrator orchestrator, int maxConcurrentJobs) {
        this.orchestrator = orchestrator;
        this.executor = Executors.newFixedThreadPool(maxConcurrentJobs, r -> {
            Thread t = new Thread(r, "orchestrator-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue the pipeline of {@code jobId}.
     *
     * @return future completing when the pipeline run has ended, whatever the job's outcome
     */
    public CompletableFuture<Void> dispatch(GenerationSpec spec, String jobId) {
        log.info("Dispatching job {}", jobId);
        try {
            return CompletableFuture.runAsync(() -> {
                try {
                    orchestrator.run(spec, jobId);
                } catch (Exception e) {
                    log.error("Pipeline of job {} crashed", jobId, e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher is shut down, job {} not started", jobId);
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Dispatcher forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
