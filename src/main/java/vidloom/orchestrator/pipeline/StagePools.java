package vidloom.orchestrator.pipeline;

import vidloom.orchestrator.config.OrchestratorConfig;
import vidloom.orchestrator.repository.JobRepository;
import vidloom.orchestrator.stage.BicubicFrameResampler;
import vidloom.orchestrator.stage.BlendFrameInterpolator;
import vidloom.orchestrator.stage.FrameBatch;
import vidloom.orchestrator.stage.GenerateRequest;
import vidloom.orchestrator.stage.GifFrameEncoder;
import vidloom.orchestrator.stage.InterpolateRequest;
import vidloom.orchestrator.stage.LinearFrameBlender;
import vidloom.orchestrator.stage.PostprocessRequest;
import vidloom.orchestrator.stage.PreprocessRequest;
import vidloom.orchestrator.stage.PreprocessResult;
import vidloom.orchestrator.stage.ResampleFrameUpscaler;
import vidloom.orchestrator.stage.SeededFrameGenerator;
import vidloom.orchestrator.stage.UpscaleRequest;
import vidloom.orchestrator.stage.VideoPostprocessor;
import vidloom.orchestrator.stage.VideoPreprocessor;
import vidloom.orchestrator.worker.ElasticWorkerPool;
import vidloom.orchestrator.worker.PoolStats;
import vidloom.orchestrator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * One worker pool per stage kind.
 */
public record StagePools(
        WorkerPool<PreprocessRequest, PreprocessResult> preprocess,
        WorkerPool<GenerateRequest, FrameBatch> generate,
        WorkerPool<InterpolateRequest, FrameBatch> interpolate,
        WorkerPool<UpscaleRequest, FrameBatch> upscale,
        WorkerPool<PostprocessRequest, Path> postprocess) implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StagePools.class);

    /**
     * Pools backed by the built-in reference workers, sized from {@code config}.
     */
    public static StagePools create(OrchestratorConfig config, JobRepository jobRepository) {
        return new StagePools(
                new ElasticWorkerPool<>(StageKind.PREPROCESS,
                        () -> new VideoPreprocessor(config.preprocessorSettings()),
                        config.poolConfig(StageKind.PREPROCESS), jobRepository),
                new ElasticWorkerPool<>(StageKind.GENERATE,
                        SeededFrameGenerator::new,
                        config.poolConfig(StageKind.GENERATE), jobRepository),
                new ElasticWorkerPool<>(StageKind.INTERPOLATE,
                        () -> new BlendFrameInterpolator(new LinearFrameBlender()),
                        config.poolConfig(StageKind.INTERPOLATE), jobRepository),
                new ElasticWorkerPool<>(StageKind.UPSCALE,
                        () -> new ResampleFrameUpscaler(new BicubicFrameResampler()),
                        config.poolConfig(StageKind.UPSCALE), jobRepository),
                new ElasticWorkerPool<>(StageKind.POSTPROCESS,
                        () -> new VideoPostprocessor(config.postprocessorSettings(),
                                List.of(new GifFrameEncoder(config.postprocessorSettings().gifLoopCount()))),
                        config.poolConfig(StageKind.POSTPROCESS), jobRepository));
    }

    public List<WorkerPool<?, ?>> all() {
        return List.of(preprocess, generate, interpolate, upscale, postprocess);
    }

    public List<PoolStats> stats() {
        return all().stream().map(WorkerPool::stats).toList();
    }

    /**
     * @return total replicas retired across all pools
     */
    public int retireIdle() {
        int retired = 0;
        for (WorkerPool<?, ?> pool : all()) {
            retired += pool.retireIdle();
        }
        return retired;
    }

    @Override
    public void close() {
        for (WorkerPool<?, ?> pool : all()) {
            try {
                pool.close();
            } catch (Exception e) {
                log.warn("Error closing worker pool '{}': {}", pool.kind().id(), e.getMessage());
            }
        }
    }
}
