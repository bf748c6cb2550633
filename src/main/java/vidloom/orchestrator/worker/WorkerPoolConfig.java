package vidloom.orchestrator.worker;

import java.time.Duration;
import java.util.Objects;

/**
 * Scaling policy of one worker pool.
 */
public record WorkerPoolConfig(int minReplicas, int maxReplicas, Duration downscaleDelay) {

    public WorkerPoolConfig {
        Objects.requireNonNull(downscaleDelay, "downscaleDelay is required");
        if (minReplicas < 0) {
            throw new IllegalArgumentException("minReplicas must be non-negative");
        }
        if (maxReplicas < 1 || maxReplicas < minReplicas) {
            throw new IllegalArgumentException(
                    "maxReplicas must be at least 1 and at least minReplicas, got " + minReplicas + "/" + maxReplicas);
        }
        if (downscaleDelay.isNegative()) {
            throw new IllegalArgumentException("downscaleDelay must not be negative");
        }
    }

    public static WorkerPoolConfig of(int minReplicas, int maxReplicas) {
        return new WorkerPoolConfig(minReplicas, maxReplicas, Duration.ofSeconds(60));
    }

    public WorkerPoolConfig withMinReplicas(int min) {
        return new WorkerPoolConfig(min, maxReplicas, downscaleDelay);
    }

    public WorkerPoolConfig withMaxReplicas(int max) {
        return new WorkerPoolConfig(minReplicas, max, downscaleDelay);
    }

    public WorkerPoolConfig withDownscaleDelay(Duration delay) {
        return new WorkerPoolConfig(minReplicas, maxReplicas, delay);
    }
}
