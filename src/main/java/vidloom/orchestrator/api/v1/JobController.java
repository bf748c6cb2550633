package vidloom.orchestrator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import vidloom.orchestrator.api.Controller;
import vidloom.orchestrator.api.v1.dto.CreateJobRequest;
import vidloom.orchestrator.api.v1.dto.JobResponse;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.server.RouterHandler;
import vidloom.orchestrator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job management (public API).
 *
 * POST /api/v1/jobs - Create and start a job
 * GET /api/v1/jobs?limit=N - Recent jobs
 * GET /api/v1/jobs/unread?ownerId=X - Finished jobs not yet seen by their owner
 * GET /api/v1/jobs/{jobId} - Job status, progress and result
 * POST /api/v1/jobs/{jobId}/cancel - Request cancellation
 * POST /api/v1/jobs/{jobId}/read - Mark as read
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern UNREAD_PATTERN = Pattern.compile("^/api/v1/jobs/unread$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");
    private static final Pattern JOB_READ_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/read$");

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() ||
                    JOB_CANCEL_PATTERN.matcher(path).matches() ||
                    JOB_READ_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() ||
                    JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean post = req.method().equals(HttpMethod.POST);

            if (post && JOBS_PATTERN.matcher(path).matches()) {
                return handleCreateJob(req);
            }

            Matcher cancelMatcher = JOB_CANCEL_PATTERN.matcher(path);
            if (post && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher readMatcher = JOB_READ_PATTERN.matcher(path);
            if (post && readMatcher.matches()) {
                return handleMarkRead(readMatcher.group(1));
            }

            if (!post && JOBS_PATTERN.matcher(path).matches()) {
                return handleListRecent(req);
            }

            if (!post && UNREAD_PATTERN.matcher(path).matches()) {
                return handleListUnread(req);
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (!post && jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateJobRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, CreateJobRequest.class);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON body: " + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }

        Job job = jobService.submit(request.toGenerationRequest(), request.ownerId());

        Map<String, Object> response = Map.of(
                "jobId", job.id(),
                "status", job.status().name());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs?limit=N
     */
    private ControllerResponse handleListRecent(FullHttpRequest req) throws Exception {
        int limit = DEFAULT_LIMIT;
        String limitParam = queryParam(req, "limit");
        if (limitParam != null) {
            try {
                limit = Integer.parseInt(limitParam);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number", e);
            }
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
        }

        List<JobResponse> jobs = jobService.findRecent(limit).stream()
                .map(JobResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("jobs", jobs)));
    }

    /**
     * GET /api/v1/jobs/unread?ownerId=X
     */
    private ControllerResponse handleListUnread(FullHttpRequest req) throws Exception {
        String ownerId = queryParam(req, "ownerId");
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }

        List<JobResponse> jobs = jobService.findUnread(ownerId).stream()
                .map(JobResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("jobs", jobs)));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> jobOpt = jobService.findById(jobId);
        if (jobOpt.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        Job job = jobOpt.get();
        JobResponse response = JobResponse.from(job, jobService.findResult(jobId).orElse(null));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/jobs/{jobId}/cancel
     */
    private ControllerResponse handleCancel(String jobId) throws Exception {
        Optional<Job> jobOpt = jobService.findById(jobId);
        if (jobOpt.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        if (!jobService.cancel(jobId)) {
            // Re-read: the job may have finished between the lookup and the update
            String status = jobService.findById(jobId).map(j -> j.status().name()).orElse("UNKNOWN");
            return ControllerResponse.conflict("job cannot be cancelled in status " + status);
        }

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("ok", true)));
    }

    /**
     * POST /api/v1/jobs/{jobId}/read
     */
    private ControllerResponse handleMarkRead(String jobId) throws Exception {
        if (!jobService.markAsRead(jobId)) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("ok", true)));
    }

    private static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }
}
