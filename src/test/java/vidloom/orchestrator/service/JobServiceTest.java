package vidloom.orchestrator.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vidloom.orchestrator.model.AspectRatio;
import vidloom.orchestrator.model.BaseModel;
import vidloom.orchestrator.model.GenerationRequest;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.model.JobStatus;
import vidloom.orchestrator.model.ResolutionClass;
import vidloom.orchestrator.pipeline.PipelineOrchestrator;
import vidloom.orchestrator.pipeline.ProgressAllocator;
import vidloom.orchestrator.pipeline.ProgressBudgets;
import vidloom.orchestrator.support.InMemoryJobRepository;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private InMemoryJobRepository repo;
    private JobDispatcher dispatcher;
    private JobService service;

    @BeforeEach
    void setup() {
        repo = new InMemoryJobRepository();
        // Never reached: these tests either shut the dispatcher down or do not submit
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(repo, null, null,
                new ProgressAllocator(ProgressBudgets.defaults()), 8, Path.of("outputs"));
        dispatcher = new JobDispatcher(orchestrator, 1);
        service = new JobService(repo, dispatcher, new GenerationRequestConverter(() -> 7L));
    }

    @AfterEach
    void teardown() {
        dispatcher.close();
    }

    private static GenerationRequest request() {
        return new GenerationRequest("lighthouse in a storm", null, AspectRatio.LANDSCAPE_3_2,
                ResolutionClass.P480, 2, 8, "gif", BaseModel.EPIC_REALISM, null, 10);
    }

    @Test
    @DisplayName("A job the dispatcher refuses ends FAILED instead of staying PENDING")
    void rejectedDispatchFailsJob() {
        dispatcher.close();

        Job job = service.submit(request(), "user-1");

        Job stored = repo.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.status());
        assertTrue(stored.errorMessage().startsWith("Job could not be dispatched"));
        assertTrue(stored.status().isTerminal());
    }

    @Test
    void cancelPendingJob() {
        Job job = service.createJob(new GenerationRequestConverter(() -> 7L).convert(request()), "user-1");

        assertTrue(service.cancel(job.id()));
        assertFalse(service.cancel(job.id()));
        assertEquals(JobStatus.CANCELLED, repo.findById(job.id()).orElseThrow().status());
    }

    @Test
    void cancelUnknownJob() {
        assertFalse(service.cancel("no-such-job"));
    }
}
