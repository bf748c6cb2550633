package vidloom.orchestrator.scheduler;

import vidloom.orchestrator.pipeline.StagePools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that scales worker pools down.
 *
 * Replicas idle for longer than their pool's downscale delay are retired,
 * never below the pool's minimum replica count.
 */
public class PoolReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PoolReaper.class);

    private final StagePools pools;

    public PoolReaper(StagePools pools) {
        this.pools = pools;
    }

    @Override
    public void run() {
        try {
            reapIdleReplicas();
        } catch (Exception e) {
            log.error("Pool reaper error", e);
        }
    }

    /**
     * @return number of replicas retired
     */
    public int reapIdleReplicas() {
        int retired = pools.retireIdle();
        if (retired > 0) {
            log.info("Pool reaper: retired {} idle replica(s)", retired);
        } else {
            log.debug("No idle replicas to retire");
        }
        return retired;
    }
}
