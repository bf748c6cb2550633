package vidloom.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import vidloom.orchestrator.worker.PoolStats;

import java.util.List;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("objectStore") String objectStore,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pools") List<PoolStats> pools) {

    public static HealthResponse healthy(boolean objectStoreUp, String uptime, String version, List<PoolStats> pools) {
        return new HealthResponse("healthy", "ok", objectStoreUp ? "ok" : "unavailable", uptime, version, pools);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null);
    }
}
