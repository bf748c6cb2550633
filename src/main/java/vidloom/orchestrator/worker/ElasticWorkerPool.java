package vidloom.orchestrator.worker;

import vidloom.orchestrator.pipeline.CancellableExecutor;
import vidloom.orchestrator.pipeline.ProgressRange;
import vidloom.orchestrator.pipeline.ProgressTracker;
import vidloom.orchestrator.pipeline.StageContext;
import vidloom.orchestrator.pipeline.StageKind;
import vidloom.orchestrator.pipeline.StageOutcome;
import vidloom.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-process elastic pool of stage worker replicas.
 *
 * Each call leases an idle replica, or creates one while fewer than
 * {@code maxReplicas} exist; otherwise it waits in FIFO order for a replica to
 * be returned. A replica serves one job at a time. Replicas idle for longer than
 * the downscale delay are retired by {@link #retireIdle()} down to {@code minReplicas}.
 */
public class ElasticWorkerPool<I, O> implements WorkerPool<I, O> {

    private static final Logger log = LoggerFactory.getLogger(ElasticWorkerPool.class);

    private final StageKind kind;
    private final Supplier<? extends StageWorker<I, O>> workerFactory;
    private final WorkerPoolConfig config;
    private final JobRepository jobRepository;
    private final ExecutorService executor;
    private final Semaphore permits;

    // Guarded by "this"
    private final Deque<Replica<I, O>> idle = new ArrayDeque<>();
    private int replicaCount;

    private final AtomicInteger replicaSeq = new AtomicInteger();
    private final AtomicInteger threadSeq = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean closed = false;

    public ElasticWorkerPool(StageKind kind, Supplier<? extends StageWorker<I, O>> workerFactory,
            WorkerPoolConfig config, JobRepository jobRepository) {
        this.kind = kind;
        this.workerFactory = workerFactory;
        this.config = config;
        this.jobRepository = jobRepository;
        this.permits = new Semaphore(config.maxReplicas(), true);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pool-" + kind.id() + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        synchronized (this) {
            for (int i = 0; i < config.minReplicas(); i++) {
                idle.addLast(newReplica());
            }
        }
        log.info("Worker pool '{}' started with {} replica(s), max {}",
                kind.id(), config.minReplicas(), config.maxReplicas());
    }

    @Override
    public StageKind kind() {
        return kind;
    }

    public WorkerPoolConfig config() {
        return config;
    }

    @Override
    public CompletableFuture<StageOutcome<O>> execute(I request, String jobId, ProgressRange window) {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Worker pool '" + kind.id() + "' is closed"));
        }
        return CompletableFuture.supplyAsync(() -> invoke(request, jobId, window), executor);
    }

    private StageOutcome<O> invoke(I request, String jobId, ProgressRange window) {
        Replica<I, O> replica = lease();
        inFlight.incrementAndGet();
        try {
            ProgressTracker tracker = new ProgressTracker(jobRepository, jobId, window, kind.stepLabel());
            return replica.executor.execute(jobId, kind, cancellation -> replica.worker.process(
                    request, new StageContext(jobId, window, cancellation, tracker)));
        } finally {
            inFlight.decrementAndGet();
            release(replica);
        }
    }

    private Replica<I, O> lease() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(
                    new IllegalStateException("Interrupted while waiting for a '" + kind.id() + "' replica", e));
        }

        synchronized (this) {
            Replica<I, O> replica = idle.pollLast();
            if (replica != null) {
                return replica;
            }
            try {
                replica = newReplica();
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
            log.info("Worker pool '{}' scaled up to {} replica(s)", kind.id(), replicaCount);
            return replica;
        }
    }

    private void release(Replica<I, O> replica) {
        synchronized (this) {
            replica.idleSince = Instant.now();
            idle.addLast(replica);
        }
        permits.release();
    }

    // Caller holds the monitor
    private Replica<I, O> newReplica() {
        String replicaId = kind.id() + "-" + replicaSeq.incrementAndGet();
        StageWorker<I, O> worker = workerFactory.get();
        replicaCount++;
        return new Replica<>(replicaId, worker, new CancellableExecutor(replicaId, jobRepository));
    }

    @Override
    public synchronized int retireIdle() {
        Instant cutoff = Instant.now().minus(config.downscaleDelay());
        int retired = 0;

        // Oldest idle replicas sit at the head
        Iterator<Replica<I, O>> it = idle.iterator();
        while (it.hasNext() && replicaCount > config.minReplicas()) {
            Replica<I, O> replica = it.next();
            if (replica.idleSince.isAfter(cutoff)) {
                break;
            }
            it.remove();
            replicaCount--;
            retired++;
            log.debug("Retired replica {}", replica.id);
        }

        if (retired > 0) {
            log.info("Worker pool '{}' scaled down to {} replica(s)", kind.id(), replicaCount);
        }
        return retired;
    }

    @Override
    public synchronized PoolStats stats() {
        return new PoolStats(
                kind.id(),
                replicaCount - idle.size(),
                idle.size(),
                inFlight.get(),
                config.minReplicas(),
                config.maxReplicas());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool '{}' forcefully stopped", kind.id());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Worker pool '{}' closed", kind.id());
    }

    private static final class Replica<I, O> {
        private final String id;
        private final StageWorker<I, O> worker;
        private final CancellableExecutor executor;
        private Instant idleSince = Instant.now();

        private Replica(String id, StageWorker<I, O> worker, CancellableExecutor executor) {
            this.id = id;
            this.worker = worker;
            this.executor = executor;
        }
    }
}
