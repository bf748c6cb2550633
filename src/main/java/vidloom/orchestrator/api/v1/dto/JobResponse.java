package vidloom.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.model.JobResult;

import java.time.Instant;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("name") String name,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("currentStep") String currentStep,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("markedAsRead") boolean markedAsRead,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("result") ResultInfo result) {

    /** Where the finished video is stored. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResultInfo(
            @JsonProperty("bucket") String bucket,
            @JsonProperty("objectKey") String objectKey,
            @JsonProperty("sizeBytes") long sizeBytes) {

        public static ResultInfo from(JobResult result) {
            return new ResultInfo(result.bucket(), result.objectKey(), result.sizeBytes());
        }
    }

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return from(job, null);
    }

    /** Create response with the stored result, if any */
    public static JobResponse from(Job job, JobResult result) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.status().name(),
                job.progressPercentage(),
                job.currentStep(),
                job.errorMessage(),
                job.markedAsRead(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                result != null ? ResultInfo.from(result) : null);
    }
}
