package vidloom.orchestrator.scheduler;

import vidloom.orchestrator.config.OrchestratorConfig;
import vidloom.orchestrator.pipeline.StagePools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background maintenance on a single thread. Currently the only task is
 * the {@link PoolReaper}.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final PoolReaper poolReaper;
    private final OrchestratorConfig config;

    private volatile boolean running = false;

    public Scheduler(StagePools pools, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "vidloom-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.poolReaper = new PoolReaper(pools);
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long reapIntervalMs = config.poolReapInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("pool-reaper", poolReaper),
                reapIntervalMs,
                reapIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Pool reaper scheduled every {}ms", reapIntervalMs);
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public PoolReaper poolReaper() {
        return poolReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
