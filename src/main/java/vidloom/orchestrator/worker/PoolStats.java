package vidloom.orchestrator.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time replica counts of one pool.
 */
public record PoolStats(
        @JsonProperty("stage") String stage,
        @JsonProperty("activeReplicas") int activeReplicas,
        @JsonProperty("idleReplicas") int idleReplicas,
        @JsonProperty("inFlight") int inFlight,
        @JsonProperty("minReplicas") int minReplicas,
        @JsonProperty("maxReplicas") int maxReplicas) {

    public int totalReplicas() {
        return activeReplicas + idleReplicas;
    }
}
