package vidloom.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.model.JobResult;
import vidloom.orchestrator.model.JobStatus;
import vidloom.orchestrator.model.JobStatusView;
import vidloom.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Double>> LORA_MAP = new TypeReference<>() {
    };
    private static final int MAX_STEP_LENGTH = 255;

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public Job createJob(GenerationSpec spec, String ownerId) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .name(Job.nameFromPrompt(spec.prompt()))
                .status(JobStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        String jobSql = """
                    INSERT INTO jobs (id, owner_id, name, status, progress_percentage, marked_as_read, created_at)
                    VALUES (?, ?, ?, ?, 0, FALSE, ?)
                """;
        String paramsSql = """
                    INSERT INTO job_parameters (job_id, prompt, negative_prompt, width, height, video_length, fps,
                                                base_model, motion_adapter, loras, inference_steps, guidance_scale,
                                                seed, output_format)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(jobSql)) {
                ps.setString(1, job.id());
                ps.setString(2, job.ownerId());
                ps.setString(3, job.name());
                ps.setString(4, job.status().name());
                ps.setTimestamp(5, Timestamp.from(job.createdAt()));
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement(paramsSql)) {
                ps.setString(1, job.id());
                ps.setString(2, spec.prompt());
                ps.setString(3, spec.negativePrompt());
                ps.setInt(4, spec.width());
                ps.setInt(5, spec.height());
                ps.setInt(6, spec.videoLength());
                ps.setInt(7, spec.fps());
                ps.setString(8, spec.baseModel());
                ps.setString(9, spec.motionAdapter());
                ps.setString(10, toJson(spec.loras()));
                ps.setInt(11, spec.inferenceSteps());
                ps.setDouble(12, spec.guidanceScale());
                ps.setLong(13, spec.seed());
                ps.setString(14, spec.outputFormat());
                ps.executeUpdate();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            conn.commit();
            log.debug("Created job: {}", job.id());
            return job;
        } catch (SQLException e) {
            throw new StoreException("Failed to create job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public Optional<JobStatusView> getStatus(String jobId) {
        String sql = """
                    SELECT status, progress_percentage, current_step, error_message
                    FROM jobs WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(new JobStatusView(
                        jobId,
                        JobStatus.valueOf(rs.getString("status")),
                        rs.getInt("progress_percentage"),
                        rs.getString("current_step"),
                        rs.getString("error_message")));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to read job status: " + jobId, e);
        }
    }

    @Override
    public Optional<GenerationSpec> findParameters(String jobId) {
        String sql = "SELECT * FROM job_parameters WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(GenerationSpec.builder()
                        .prompt(rs.getString("prompt"))
                        .negativePrompt(rs.getString("negative_prompt"))
                        .width(rs.getInt("width"))
                        .height(rs.getInt("height"))
                        .videoLength(rs.getInt("video_length"))
                        .fps(rs.getInt("fps"))
                        .baseModel(rs.getString("base_model"))
                        .motionAdapter(rs.getString("motion_adapter"))
                        .loras(fromJson(rs.getString("loras")))
                        .inferenceSteps(rs.getInt("inference_steps"))
                        .guidanceScale(rs.getDouble("guidance_scale"))
                        .seed(rs.getLong("seed"))
                        .outputFormat(rs.getString("output_format"))
                        .build());
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find parameters of job: " + jobId, e);
        }
    }

    @Override
    public Optional<JobResult> findResult(String jobId) {
        String sql = "SELECT * FROM job_results WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(new JobResult(
                        jobId,
                        rs.getString("object_key"),
                        rs.getString("bucket"),
                        rs.getLong("size_bytes"),
                        toInstant(rs.getTimestamp("created_at"))));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find result of job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findRecent(int limit) {
        String sql = "SELECT * FROM jobs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find recent jobs", e);
        }
    }

    @Override
    public List<Job> findUnread(String ownerId) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE owner_id = ? AND marked_as_read = FALSE
                      AND status IN ('COMPLETED', 'FAILED', 'CANCELLED')
                    ORDER BY created_at DESC
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find unread jobs of owner: " + ownerId, e);
        }
    }

    @Override
    public boolean transitionStatus(String jobId, JobStatus from, JobStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalArgumentException("Illegal job transition " + from + " -> " + to);
        }

        String sql = to == JobStatus.PROCESSING
                ? "UPDATE jobs SET status = ?, started_at = COALESCE(started_at, ?) WHERE id = ? AND status = ?"
                : "UPDATE jobs SET status = ?, completed_at = ? WHERE id = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, to.name());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);
            ps.setString(4, from.name());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Job {} moved {} -> {}", jobId, from, to);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to move job " + jobId + " to " + to, e);
        }
    }

    @Override
    public boolean setProgress(String jobId, int percentage, String step) {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("progress must be within 0..100, got " + percentage);
        }

        String sql = """
                    UPDATE jobs SET progress_percentage = GREATEST(progress_percentage, ?), current_step = ?
                    WHERE id = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, percentage);
            ps.setString(2, truncate(step));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update progress of job: " + jobId, e);
        }
    }

    @Override
    public boolean setError(String jobId, String message) {
        String sql = "UPDATE jobs SET error_message = ? WHERE id = ? AND status = 'PROCESSING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, message);
            ps.setString(2, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to set error of job: " + jobId, e);
        }
    }

    @Override
    public boolean markFailed(String jobId, String message) {
        String sql = """
                    UPDATE jobs SET status = 'FAILED', error_message = ?, completed_at = ?
                    WHERE id = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, message);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark job failed: " + jobId, e);
        }
    }

    @Override
    public boolean saveResult(String jobId, String objectKey, String bucket, long sizeBytes) {
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement lock = conn.prepareStatement(
                    "SELECT status FROM jobs WHERE id = ? FOR UPDATE")) {
                lock.setString(1, jobId);
                ResultSet rs = lock.executeQuery();
                if (!rs.next() || !JobStatus.PROCESSING.name().equals(rs.getString("status"))) {
                    conn.rollback();
                    return false;
                }
            }

            try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO job_results (job_id, object_key, bucket, size_bytes, created_at)
                        VALUES (?, ?, ?, ?, ?)
                    """)) {
                ps.setString(1, jobId);
                ps.setString(2, objectKey);
                ps.setString(3, bucket);
                ps.setLong(4, sizeBytes);
                ps.setTimestamp(5, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            conn.commit();
            return true;
        } catch (SQLException e) {
            throw new StoreException("Failed to save result of job: " + jobId, e);
        }
    }

    @Override
    public boolean requestCancel(String jobId) {
        String sql = """
                    UPDATE jobs SET status = 'CANCELLED', completed_at = ?
                    WHERE id = ? AND status IN ('PENDING', 'PROCESSING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to cancel job: " + jobId, e);
        }
    }

    @Override
    public boolean isCancelled(String jobId) {
        return hasStatus(jobId, JobStatus.CANCELLED);
    }

    @Override
    public boolean isCompleted(String jobId) {
        return hasStatus(jobId, JobStatus.COMPLETED);
    }

    @Override
    public boolean markAsRead(String jobId) {
        String sql = "UPDATE jobs SET marked_as_read = TRUE WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark job as read: " + jobId, e);
        }
    }

    // --- Helpers ---

    private boolean hasStatus(String jobId, JobStatus status) {
        String sql = "SELECT status FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();
            return rs.next() && status.name().equals(rs.getString("status"));
        } catch (SQLException e) {
            throw new StoreException("Failed to read status of job: " + jobId, e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        ResultSet rs = ps.executeQuery();
        while (rs.next()) {
            jobs.add(mapRow(rs));
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .ownerId(rs.getString("owner_id"))
                .name(rs.getString("name"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .progressPercentage(rs.getInt("progress_percentage"))
                .currentStep(rs.getString("current_step"))
                .errorMessage(rs.getString("error_message"))
                .markedAsRead(rs.getBoolean("marked_as_read"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static String truncate(String step) {
        if (step == null || step.length() <= MAX_STEP_LENGTH) {
            return step;
        }
        return step.substring(0, MAX_STEP_LENGTH);
    }

    private static String toJson(Map<String, Double> loras) {
        try {
            return MAPPER.writeValueAsString(loras);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("LoRA weights are not serializable", e);
        }
    }

    private static Map<String, Double> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, LORA_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt LoRA weights: " + json, e);
        }
    }
}
