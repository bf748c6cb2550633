package vidloom.orchestrator.pipeline;

import vidloom.orchestrator.config.OrchestratorConfig;
import vidloom.orchestrator.model.GenerationSpec;
import vidloom.orchestrator.model.JobStatus;
import vidloom.orchestrator.repository.JobRepository;
import vidloom.orchestrator.stage.FrameBatch;
import vidloom.orchestrator.stage.PreprocessResult;
import vidloom.orchestrator.stage.StageRequests;
import vidloom.orchestrator.storage.ObjectStore;
import vidloom.orchestrator.storage.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Drives one job through preprocess, generate, optional interpolate, optional
 * upscale and postprocess, then uploads the video and completes the job.
 *
 * <p>
 * Every job ends in a terminal status:
 * <ul>
 * <li>a stage that observes cancellation stops the pipeline without touching the status</li>
 * <li>any other error marks the job FAILED, unless it was cancelled meanwhile</li>
 * <li>the local video file is deleted whatever the outcome</li>
 * </ul>
 * {@link #run} never throws.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final JobRepository jobRepository;
    private final StagePools pools;
    private final ObjectStore objectStore;
    private final ProgressAllocator allocator;
    private final int baseFps;
    private final Path outputDir;

    public PipelineOrchestrator(JobRepository jobRepository, StagePools pools, ObjectStore objectStore,
            OrchestratorConfig config) {
        this(jobRepository, pools, objectStore, new ProgressAllocator(config.progressBudgets()),
                config.baseFps(), config.outputDir());
    }

    public PipelineOrchestrator(JobRepository jobRepository, StagePools pools, ObjectStore objectStore,
            ProgressAllocator allocator, int baseFps, Path outputDir) {
        this.jobRepository = jobRepository;
        this.pools = pools;
        this.objectStore = objectStore;
        this.allocator = allocator;
        this.baseFps = baseFps;
        this.outputDir = outputDir;
    }

    /**
     * Run the pipeline for a PENDING job. A job that is not PENDING (already
     * running, finished or cancelled) is left alone.
     */
    public void run(GenerationSpec spec, String jobId) {
        Path artifact = null;
        try {
            if (!jobRepository.transitionStatus(jobId, JobStatus.PENDING, JobStatus.PROCESSING)) {
                log.info("Job {} is not PENDING, skipping pipeline run", jobId);
                return;
            }
            log.info("Job {}: pipeline started ({})", jobId, spec);

            // Preprocess
            ProgressRange preprocessing = allocator.preprocessingRange();
            jobRepository.setProgress(jobId, preprocessing.start(), "Processing parameters");
            StageOutcome<PreprocessResult> planned = await(pools.preprocess()
                    .execute(StageRequests.toPreprocessRequest(spec), jobId, preprocessing));
            if (stopped(planned, jobId, StageKind.PREPROCESS)) {
                return;
            }
            PreprocessResult plan = planned.value();

            StageRanges ranges = allocator.allocate(plan.needsInterpolation(), plan.needsUpscaling());
            log.info("Job {}: plan {} -> {}", jobId, plan, ranges);

            // Generate
            StageOutcome<FrameBatch> generated = await(pools.generate()
                    .execute(StageRequests.toGenerateRequest(spec, plan, baseFps), jobId, ranges.generation()));
            if (stopped(generated, jobId, StageKind.GENERATE)) {
                return;
            }
            FrameBatch frames = generated.value();
            if (frames == null || frames.isEmpty()) {
                throw new IllegalStateException("Frame generation produced no frames");
            }

            // Interpolate
            if (plan.needsInterpolation()) {
                jobRepository.setProgress(jobId, ranges.interpolation().start(), "Starting frame interpolation");
                StageOutcome<FrameBatch> interpolated = await(pools.interpolate()
                        .execute(StageRequests.toInterpolateRequest(frames, plan), jobId, ranges.interpolation()));
                if (stopped(interpolated, jobId, StageKind.INTERPOLATE)) {
                    return;
                }
                frames = interpolated.value();
            } else {
                log.info("Job {}: no interpolation needed", jobId);
            }

            // Upscale
            if (plan.needsUpscaling()) {
                jobRepository.setProgress(jobId, ranges.upscaling().start(), "Starting frame upscaling");
                StageOutcome<FrameBatch> upscaled = await(pools.upscale()
                        .execute(StageRequests.toUpscaleRequest(frames, plan), jobId, ranges.upscaling()));
                if (stopped(upscaled, jobId, StageKind.UPSCALE)) {
                    return;
                }
                frames = upscaled.value();
            } else {
                log.info("Job {}: no upscaling needed", jobId);
            }

            if (frames == null || frames.isEmpty()) {
                throw new IllegalStateException("No frames left to postprocess");
            }

            // Postprocess
            int finalFps = baseFps * plan.fpsFactor();
            jobRepository.setProgress(jobId, ranges.saving().start(), "Post-processing and saving video");
            StageOutcome<Path> saved = await(pools.postprocess().execute(
                    StageRequests.toPostprocessRequest(frames, spec, finalFps, outputDir), jobId, ranges.saving()));
            if (stopped(saved, jobId, StageKind.POSTPROCESS)) {
                // A video written before the cancel was noticed still gets cleaned up
                artifact = saved.discarded();
                return;
            }
            artifact = saved.value();
            if (artifact == null || !Files.isRegularFile(artifact)) {
                throw new IllegalStateException("Postprocessing did not produce a video file: " + artifact);
            }

            // Upload and complete
            jobRepository.setProgress(jobId, ranges.saving().start(), "Uploading to storage");
            StoredObject stored = objectStore.upload(artifact, jobId);
            if (!jobRepository.saveResult(jobId, stored.objectKey(), stored.bucket(), stored.sizeBytes())) {
                if (jobRepository.isCancelled(jobId)) {
                    log.info("Job {} was cancelled during upload, result not recorded", jobId);
                    return;
                }
                throw new IllegalStateException("Could not record result of job " + jobId);
            }
            jobRepository.setProgress(jobId, 100, "Completed");
            if (jobRepository.transitionStatus(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED)) {
                log.info("Job {} completed: {}/{} ({} bytes)",
                        jobId, stored.bucket(), stored.objectKey(), stored.sizeBytes());
            } else {
                log.info("Job {} left PROCESSING before completion, status unchanged", jobId);
            }
        } catch (Exception e) {
            handleFailure(jobId, unwrap(e));
        } finally {
            if (artifact != null) {
                objectStore.cleanupLocal(artifact);
            }
        }
    }

    private boolean stopped(StageOutcome<?> outcome, String jobId, StageKind kind) {
        if (outcome.isCancelled()) {
            log.info("Job {} cancelled during {}, pipeline stopped", jobId, kind.operation());
            return true;
        }
        return false;
    }

    private void handleFailure(String jobId, Throwable error) {
        if (cancelledQuietly(jobId)) {
            log.info("Job {} was cancelled, ignoring error: {}", jobId, error.getMessage());
            return;
        }

        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("Job {} failed: {}", jobId, message, error);
        try {
            if (!jobRepository.markFailed(jobId, message)) {
                log.warn("Job {} was not PROCESSING, failure not recorded", jobId);
            }
        } catch (RuntimeException e) {
            log.error("Could not mark job {} as failed", jobId, e);
        }
    }

    private boolean cancelledQuietly(String jobId) {
        try {
            return jobRepository.isCancelled(jobId);
        } catch (RuntimeException e) {
            log.warn("Could not read cancellation state of job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    /**
     * Block until the stage finishes and rethrow its fault as-is.
     * If the waiting thread is interrupted the stage itself keeps running and
     * holds its replica until it completes or reaches a cancelled checkpoint.
     */
    private static <T> StageOutcome<T> await(CompletableFuture<StageOutcome<T>> future) throws Exception {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
