package vidloom.orchestrator.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.model.Job;
import vidloom.orchestrator.model.JobResult;
import vidloom.orchestrator.model.JobStatus;
import vidloom.orchestrator.stage.FrameBatch;
import vidloom.orchestrator.stage.GenerateRequest;
import vidloom.orchestrator.stage.InterpolateRequest;
import vidloom.orchestrator.stage.PostprocessRequest;
import vidloom.orchestrator.stage.PreprocessRequest;
import vidloom.orchestrator.stage.PreprocessResult;
import vidloom.orchestrator.stage.UpscaleRequest;
import vidloom.orchestrator.storage.ObjectStore;
import vidloom.orchestrator.storage.StoredObject;
import vidloom.orchestrator.support.InMemoryJobRepository;
import vidloom.orchestrator.worker.ElasticWorkerPool;
import vidloom.orchestrator.worker.StageWorker;
import vidloom.orchestrator.worker.WorkerPoolConfig;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    @TempDir
    Path outputDir;

    private InMemoryJobRepository repo;
    private RecordingObjectStore objectStore;
    private StagePools pools;

    // Stage behaviour, replaced per test
    private StageWorker<PreprocessRequest, PreprocessResult> preprocessor;
    private StageWorker<GenerateRequest, FrameBatch> generator;
    private StageWorker<InterpolateRequest, FrameBatch> interpolator;
    private StageWorker<UpscaleRequest, FrameBatch> upscaler;
    private StageWorker<PostprocessRequest, Path> postprocessor;

    private final AtomicInteger interpolateCalls = new AtomicInteger();
    private final AtomicInteger upscaleCalls = new AtomicInteger();
    private final AtomicInteger postprocessCalls = new AtomicInteger();
    private final AtomicReference<PostprocessRequest> lastPostprocess = new AtomicReference<>();
    private final List<Path> artifacts = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setup() {
        repo = new InMemoryJobRepository();
        objectStore = new RecordingObjectStore();

        preprocessor = (request, context) -> new PreprocessResult(2, 2, 16, 16, 2);
        generator = (request, context) -> {
            List<BufferedImage> frames = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                context.checkpoint("step " + i);
                frames.add(new BufferedImage(request.width(), request.height(), BufferedImage.TYPE_INT_RGB));
                context.reportProgress(i, 4);
            }
            return new FrameBatch(frames);
        };
        interpolator = (request, context) -> {
            interpolateCalls.incrementAndGet();
            List<BufferedImage> frames = new ArrayList<>(request.frames().frames());
            frames.addAll(request.frames().frames());
            return new FrameBatch(frames);
        };
        upscaler = (request, context) -> {
            upscaleCalls.incrementAndGet();
            return request.frames();
        };
        postprocessor = (request, context) -> {
            postprocessCalls.incrementAndGet();
            lastPostprocess.set(request);
            Files.createDirectories(request.outputDir());
            Path file = request.outputDir().resolve(context.jobId() + "-video." + request.outputFormat());
            Files.writeString(file, "GIF89a");
            artifacts.add(file);
            return file;
        };
    }

    @AfterEach
    void teardown() {
        if (pools != null) {
            pools.close();
        }
    }

    private PipelineOrchestrator orchestrator() {
        WorkerPoolConfig single = WorkerPoolConfig.of(1, 1);
        pools = new StagePools(
                new ElasticWorkerPool<>(StageKind.PREPROCESS, () -> preprocessor, single, repo),
                new ElasticWorkerPool<>(StageKind.GENERATE, () -> generator, single, repo),
                new ElasticWorkerPool<>(StageKind.INTERPOLATE, () -> interpolator, single, repo),
                new ElasticWorkerPool<>(StageKind.UPSCALE, () -> upscaler, single, repo),
                new ElasticWorkerPool<>(StageKind.POSTPROCESS, () -> postprocessor, single, repo));
        return new PipelineOrchestrator(repo, pools, objectStore,
                new ProgressAllocator(ProgressBudgets.defaults()), 8, outputDir);
    }

    private static GenerationSpec spec() {
        return GenerationSpec.builder()
                .prompt("waves crashing on rocks")
                .negativePrompt("")
                .width(32)
                .height(32)
                .videoLength(1)
                .fps(16)
                .baseModel("sd15")
                .inferenceSteps(3)
                .guidanceScale(7.5)
                .seed(11)
                .outputFormat("gif")
                .build();
    }

    private Job runNewJob() {
        Job job = repo.createJob(spec(), "user-1");
        orchestrator().run(spec(), job.id());
        return repo.findById(job.id()).orElseThrow();
    }

    private static void assertNonDecreasing(List<Integer> values) {
        for (int i = 1; i < values.size(); i++) {
            assertTrue(values.get(i) >= values.get(i - 1), "progress went backwards: " + values);
        }
    }

    @Test
    void completesJobAndRecordsResult() {
        Job job = runNewJob();

        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(100, job.progressPercentage());
        assertEquals("Completed", job.currentStep());

        JobResult result = repo.findResult(job.id()).orElseThrow();
        assertEquals("videos", result.bucket());
        assertEquals(job.id() + "/" + job.id() + ".gif", result.objectKey());
        assertEquals(6, result.sizeBytes());

        assertEquals(1, interpolateCalls.get());
        assertEquals(1, upscaleCalls.get());
        assertEquals(16, lastPostprocess.get().fps());
        assertEquals(8, lastPostprocess.get().frames().size());
    }

    @Test
    @DisplayName("Progress moves through every stage window and never decreases")
    void progressIsMonotonic() {
        Job job = runNewJob();

        List<Integer> values = repo.progressValues(job.id());
        assertNonDecreasing(values);
        assertEquals(0, values.get(0));
        assertTrue(values.contains(71), "generation must reach its window end: " + values);
        assertTrue(values.contains(85));
        assertTrue(values.contains(99));
        assertEquals(100, values.get(values.size() - 1));
    }

    @Test
    void artifactIsDeletedAfterUpload() {
        runNewJob();

        assertEquals(1, objectStore.uploaded.size());
        assertFalse(Files.exists(artifacts.get(0)));
    }

    @Test
    void optionalStagesSkippedWhenNotNeeded() {
        preprocessor = (request, context) -> new PreprocessResult(1, 1, 32, 32, 1);

        Job job = runNewJob();

        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(0, interpolateCalls.get());
        assertEquals(0, upscaleCalls.get());
        assertEquals(8, lastPostprocess.get().fps());
        // Generation takes over both optional windows
        assertTrue(repo.progressValues(job.id()).contains(99));
        assertTrue(repo.progressWrites().stream().noneMatch(w -> w.step().startsWith("Starting frame")));
    }

    @Test
    @DisplayName("Cancellation observed mid-stage stops the pipeline without failing the job")
    void cancelDuringGeneration() {
        Job job = repo.createJob(spec(), "user-1");
        generator = (request, context) -> {
            context.checkpoint("step 0");
            context.reportProgress(0, 4);
            repo.requestCancel(context.jobId());
            context.checkpoint("step 1");
            return FrameBatch.empty();
        };

        orchestrator().run(spec(), job.id());

        Job after = repo.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.CANCELLED, after.status());
        assertNull(after.errorMessage());
        assertEquals(0, interpolateCalls.get());
        assertEquals(0, postprocessCalls.get());
        assertTrue(objectStore.uploaded.isEmpty());
        assertTrue(repo.findResult(job.id()).isEmpty());
    }

    @Test
    void cancelledResultOfFinishedStageIsDiscarded() {
        Job job = repo.createJob(spec(), "user-1");
        interpolator = (request, context) -> {
            interpolateCalls.incrementAndGet();
            repo.requestCancel(context.jobId());
            return request.frames();
        };

        orchestrator().run(spec(), job.id());

        assertEquals(JobStatus.CANCELLED, repo.findById(job.id()).orElseThrow().status());
        assertEquals(1, interpolateCalls.get());
        assertEquals(0, upscaleCalls.get());
    }

    @Test
    @DisplayName("A video written just before cancellation is deleted")
    void cancelAfterPostprocessWroteFileCleansUp() {
        Job job = repo.createJob(spec(), "user-1");
        StageWorker<PostprocessRequest, Path> writer = postprocessor;
        postprocessor = (request, context) -> {
            Path file = writer.process(request, context);
            repo.requestCancel(context.jobId());
            return file;
        };

        orchestrator().run(spec(), job.id());

        assertEquals(JobStatus.CANCELLED, repo.findById(job.id()).orElseThrow().status());
        assertEquals(1, artifacts.size());
        assertFalse(Files.exists(artifacts.get(0)));
        assertTrue(objectStore.uploaded.isEmpty());
        assertTrue(repo.findResult(job.id()).isEmpty());
    }

    @Test
    @DisplayName("Interrupting the orchestrator fails the job; the stage keeps its replica until it finishes")
    void interruptedWaitFailsJob() throws Exception {
        Job job = repo.createJob(spec(), "user-1");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        generator = (request, context) -> {
            started.countDown();
            release.await();
            return FrameBatch.empty();
        };
        PipelineOrchestrator orchestrator = orchestrator();

        Thread runner = new Thread(() -> orchestrator.run(spec(), job.id()));
        runner.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        runner.interrupt();
        runner.join(5_000);

        assertFalse(runner.isAlive());
        assertEquals(JobStatus.FAILED, repo.findById(job.id()).orElseThrow().status());
        assertEquals(1, pools.generate().stats().inFlight());

        release.countDown();
        long deadline = System.currentTimeMillis() + 5_000;
        while (pools.generate().stats().inFlight() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, pools.generate().stats().inFlight());
    }

    @Test
    void stageFaultFailsJob() {
        generator = (request, context) -> {
            throw new IllegalStateException("CUDA out of memory");
        };

        Job job = runNewJob();

        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("CUDA out of memory", job.errorMessage());
        assertNotNull(job.completedAt());
        assertEquals(0, postprocessCalls.get());
    }

    @Test
    void checkedFaultIsReportedWithStageName() {
        postprocessor = (request, context) -> {
            throw new IOException("disk full");
        };

        Job job = runNewJob();

        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("postprocessing failed: disk full", job.errorMessage());
    }

    @Test
    @DisplayName("A fault racing a cancellation leaves the job CANCELLED")
    void faultAfterCancellationKeepsCancelled() {
        Job job = repo.createJob(spec(), "user-1");
        generator = (request, context) -> {
            repo.requestCancel(context.jobId());
            throw new IllegalStateException("worker lost");
        };

        orchestrator().run(spec(), job.id());

        Job after = repo.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.CANCELLED, after.status());
        assertNull(after.errorMessage());
    }

    @Test
    void emptyGenerationFailsJob() {
        generator = (request, context) -> FrameBatch.empty();

        Job job = runNewJob();

        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("Frame generation produced no frames", job.errorMessage());
    }

    @Test
    void uploadFailureFailsJobAndCleansUp() {
        objectStore.failure = new IOException("bucket does not exist");

        Job job = runNewJob();

        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("bucket does not exist", job.errorMessage());
        assertFalse(Files.exists(artifacts.get(0)));
        assertTrue(repo.findResult(job.id()).isEmpty());
    }

    @Test
    void cancelDuringUploadRecordsNoResult() {
        objectStore.onUpload = jobId -> repo.requestCancel(jobId);

        Job job = runNewJob();

        assertEquals(JobStatus.CANCELLED, job.status());
        assertTrue(repo.findResult(job.id()).isEmpty());
        assertFalse(Files.exists(artifacts.get(0)));
    }

    @Test
    void jobCancelledBeforeStartNeverRuns() {
        Job job = repo.createJob(spec(), "user-1");
        repo.requestCancel(job.id());
        AtomicInteger preprocessCalls = new AtomicInteger();
        preprocessor = (request, context) -> {
            preprocessCalls.incrementAndGet();
            return new PreprocessResult(1, 1, 32, 32, 1);
        };

        orchestrator().run(spec(), job.id());

        assertEquals(0, preprocessCalls.get());
        assertEquals(JobStatus.CANCELLED, repo.findById(job.id()).orElseThrow().status());
        assertTrue(repo.progressValues(job.id()).isEmpty());
    }

    @Test
    void secondRunOfSameJobIsNoop() {
        Job job = repo.createJob(spec(), "user-1");
        PipelineOrchestrator orchestrator = orchestrator();

        orchestrator.run(spec(), job.id());
        orchestrator.run(spec(), job.id());

        assertEquals(1, postprocessCalls.get());
        assertEquals(1, objectStore.uploaded.size());
        assertEquals(JobStatus.COMPLETED, repo.findById(job.id()).orElseThrow().status());
    }

    @Test
    void progressStoreOutageInsideStageDoesNotFailJob() {
        Job job = repo.createJob(spec(), "user-1");
        generator = (request, context) -> {
            repo.failProgressWrites(true);
            try {
                context.reportProgress(0, 2);
                context.reportProgress(1, 2);
            } finally {
                repo.failProgressWrites(false);
            }
            return new FrameBatch(List.of(new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB)));
        };

        orchestrator().run(spec(), job.id());

        assertEquals(JobStatus.COMPLETED, repo.findById(job.id()).orElseThrow().status());
    }

    interface UploadHook {
        void beforeUpload(String jobId);
    }

    static class RecordingObjectStore implements ObjectStore {
        final List<Path> uploaded = new CopyOnWriteArrayList<>();
        volatile IOException failure;
        volatile UploadHook onUpload;

        @Override
        public StoredObject upload(Path localFile, String jobId) throws IOException {
            if (onUpload != null) {
                onUpload.beforeUpload(jobId);
            }
            if (failure != null) {
                throw failure;
            }
            uploaded.add(localFile);
            return new StoredObject(bucketName(), ObjectStore.objectKey(jobId, localFile), Files.size(localFile));
        }

        @Override
        public String bucketName() {
            return "videos";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }
}
