package vidloom.orchestrator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import vidloom.orchestrator.config.Dependencies;
import vidloom.orchestrator.config.OrchestratorConfig;
import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.server.OrchestratorServer;
import vidloom.orchestrator.support.LocalObjectStore;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints through the Netty server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Dependencies deps;
    private OrchestratorServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withOutputDir(tempDir.resolve("outputs"));

        deps = Dependencies.create(config,
                new LocalObjectStore(Files.createDirectories(tempDir.resolve("storage")), "videos"));
        server = new OrchestratorServer(deps.routerHandler());
        server.start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + server.port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (deps != null) {
            deps.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private Job pendingJob(String ownerId) {
        GenerationSpec spec = GenerationSpec.builder()
                .prompt("queued clip")
                .width(256)
                .height(256)
                .videoLength(1)
                .fps(8)
                .baseModel("sd15")
                .inferenceSteps(2)
                .guidanceScale(7.5)
                .seed(3)
                .outputFormat("gif")
                .build();
        return deps.jobService().createJob(spec, ownerId);
    }

    @Test
    @DisplayName("Create a job over HTTP and read it back")
    void createAndGetJob() throws Exception {
        HttpResponse<String> created = post("/api/v1/jobs", """
                {
                    "prompt": "a kite over the beach",
                    "aspectRatio": "1:1",
                    "resolution": 256,
                    "videoLength": 1,
                    "fps": 8,
                    "outputFormat": "gif",
                    "inferenceSteps": 2,
                    "ownerId": "user-1"
                }
                """);

        assertEquals(201, created.statusCode(), "Body: " + created.body());
        JsonNode createResult = MAPPER.readTree(created.body());
        String jobId = createResult.get("jobId").asText();
        assertEquals("PENDING", createResult.get("status").asText());

        HttpResponse<String> fetched = get("/api/v1/jobs/" + jobId);
        assertEquals(200, fetched.statusCode());
        JsonNode job = MAPPER.readTree(fetched.body());
        assertEquals(jobId, job.get("jobId").asText());
        assertEquals("a kite over the beach", job.get("name").asText());
        assertTrue(job.has("progress"));
        assertTrue(job.get("createdAt").isTextual());
    }

    @Test
    void unknownJobIs404() throws Exception {
        HttpResponse<String> response = get("/api/v1/jobs/does-not-exist");

        assertEquals(404, response.statusCode());
        assertEquals("job not found", MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(404, post("/api/v1/jobs/does-not-exist/cancel", "").statusCode());
        assertEquals(404, post("/api/v1/jobs/does-not-exist/read", "").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    @Test
    void invalidRequestsAre400() throws Exception {
        assertEquals(400, post("/api/v1/jobs", "{not json").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{\"prompt\": \"\"}").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{\"prompt\": \"p\", \"fps\": 12}").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{\"prompt\": \"p\", \"baseModel\": \"sdxl\"}").statusCode());
        assertEquals(400, get("/api/v1/jobs?limit=0").statusCode());
        assertEquals(400, get("/api/v1/jobs?limit=abc").statusCode());
        assertEquals(400, get("/api/v1/jobs/unread").statusCode());
    }

    @Test
    @DisplayName("Cancel a PENDING job once, then get 409")
    void cancelPendingJob() throws Exception {
        Job job = pendingJob("user-2");

        HttpResponse<String> first = post("/api/v1/jobs/" + job.id() + "/cancel", "");
        assertEquals(200, first.statusCode(), "Body: " + first.body());
        assertTrue(MAPPER.readTree(first.body()).get("ok").asBoolean());

        HttpResponse<String> second = post("/api/v1/jobs/" + job.id() + "/cancel", "");
        assertEquals(409, second.statusCode());
        assertEquals("job cannot be cancelled in status CANCELLED",
                MAPPER.readTree(second.body()).get("error").asText());

        JsonNode fetched = MAPPER.readTree(get("/api/v1/jobs/" + job.id()).body());
        assertEquals("CANCELLED", fetched.get("status").asText());
    }

    @Test
    void unreadAndMarkRead() throws Exception {
        Job job = pendingJob("user-3");
        pendingJob("user-3");
        deps.jobService().cancel(job.id());

        JsonNode unread = MAPPER.readTree(get("/api/v1/jobs/unread?ownerId=user-3").body());
        assertEquals(1, unread.get("jobs").size());
        assertEquals(job.id(), unread.get("jobs").get(0).get("jobId").asText());

        assertEquals(200, post("/api/v1/jobs/" + job.id() + "/read", "").statusCode());

        unread = MAPPER.readTree(get("/api/v1/jobs/unread?ownerId=user-3").body());
        assertEquals(0, unread.get("jobs").size());
        assertTrue(MAPPER.readTree(get("/api/v1/jobs/" + job.id()).body()).get("markedAsRead").asBoolean());
    }

    @Test
    void listRecentJobs() throws Exception {
        pendingJob(null);
        pendingJob(null);
        pendingJob(null);

        JsonNode all = MAPPER.readTree(get("/api/v1/jobs").body());
        assertEquals(3, all.get("jobs").size());

        JsonNode limited = MAPPER.readTree(get("/api/v1/jobs?limit=2").body());
        assertEquals(2, limited.get("jobs").size());
    }

    @Test
    void healthReportsDatabaseAndPools() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals("ok", health.get("database").asText());
        assertEquals("ok", health.get("objectStore").asText());
        assertEquals(5, health.get("pools").size());
        assertEquals("preprocess", health.get("pools").get(0).get("stage").asText());
    }
}
