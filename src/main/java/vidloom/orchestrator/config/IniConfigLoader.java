package vidloom.orchestrator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import vidloom.orchestrator.pipeline.ProgressBudgets;
import vidloom.orchestrator.pipeline.StageKind;
import vidloom.orchestrator.stage.PostprocessorSettings;
import vidloom.orchestrator.stage.PreprocessorSettings;
import vidloom.orchestrator.worker.WorkerPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Overlays settings from an INI file onto an {@link OrchestratorConfig}.
 * Every section and key is optional; absent keys keep their current value.
 *
 * <pre>
 * [database]       url, pool_size
 * [server]         host, port
 * [pipeline]       output_dir, max_concurrent_jobs, pool_reap_interval_s
 * [progress]       preprocessing, generation, interpolation, upscaling, saving
 * [preprocessor]   base_fps, max_generation_dimension, dimension_alignment, min_dimension, extra_generation_seconds
 * [postprocessor]  default_format, gif_loop
 * [pool.&lt;stage&gt;]   min_replicas, max_replicas, downscale_delay_s
 * [minio]          endpoint, access_key, secret_key, bucket
 * </pre>
 */
public final class IniConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IniConfigLoader.class);

    private IniConfigLoader() {
    }

    /**
     * @throws IllegalArgumentException if the file cannot be read or holds invalid values
     */
    public static OrchestratorConfig apply(OrchestratorConfig config, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Config file not found: " + file);
        }

        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file " + file, e);
        }

        try {
            applyDatabase(config, ini.get("database"));
            applyServer(config, ini.get("server"));
            applyPipeline(config, ini.get("pipeline"));
            applyProgress(config, ini.get("progress"));
            applyPreprocessor(config, ini.get("preprocessor"));
            applyPostprocessor(config, ini.get("postprocessor"));
            for (StageKind kind : StageKind.values()) {
                applyPool(config, kind, ini.get("pool." + kind.id()));
            }
            applyMinio(config, ini.get("minio"));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in config file " + file + ": " + e.getMessage(), e);
        }

        log.info("Loaded config overrides from {}", file);
        return config;
    }

    private static void applyDatabase(OrchestratorConfig config, Profile.Section s) {
        if (s == null)
            return;
        String url = opt(s, "url");
        if (url != null)
            config.withDatabaseUrl(url);
        String poolSize = opt(s, "pool_size");
        if (poolSize != null)
            config.withDatabasePoolSize(Integer.parseInt(poolSize));
    }

    private static void applyServer(OrchestratorConfig config, Profile.Section s) {
        if (s == null)
            return;
        String host = opt(s, "host");
        if (host != null)
            config.withServerHost(host);
        String port = opt(s, "port");
        if (port != null)
            config.withServerPort(Integer.parseInt(port));
    }

    private static void applyPipeline(OrchestratorConfig config, Profile.Section s) {
        if (s == null)
            return;
        String outputDir = opt(s, "output_dir");
        if (outputDir != null)
            config.withOutputDir(Path.of(outputDir));
        String maxJobs = opt(s, "max_concurrent_jobs");
        if (maxJobs != null)
            config.withMaxConcurrentJobs(Integer.parseInt(maxJobs));
        String reap = opt(s, "pool_reap_interval_s");
        if (reap != null)
            config.withPoolReapInterval(Duration.ofSeconds(Long.parseLong(reap)));
    }

    private static void applyProgress(OrchestratorConfig config, Profile.Section s) {
        if (s == null)
            return;
        ProgressBudgets current = config.progressBudgets();
        config.withProgressBudgets(new ProgressBudgets(
                intOr(s, "preprocessing", current.preprocessing()),
                intOr(s, "generation", current.generation()),
                intOr(s, "interpolation", current.interpolation()),
                intOr(s, "upscaling", current.upscaling()),
                intOr(s, "saving", current.saving())));
    }

    private static void applyPreprocessor(OrchestratorConfig config, Profile.Section s) {
        if (s == null)
            return;
        PreprocessorSettings current = config.preprocessorSettings();
        config.withPreprocessorSettings(new PreprocessorSettings(
                intOr(s, "base_fps", current.baseFps()),
                intOr(s, "max_generation_dimension", current.maxGenerationDimension()),
                intOr(s, "dimension_alignment", current.dimensionAlignment()),
                intOr(s, "min_dimension", current.minDimension()),
                intOr(s, "extra_generation_seconds", current.extraGenerationSeconds())));
    }

    private static void applyPostprocessor(OrchestratorConfig config, Profile.Section s) {
        if (s == null)
            return;
        PostprocessorSettings current = config.postprocessorSettings();
        String format = opt(s, "default_format");
        config.withPostprocessorSettings(new PostprocessorSettings(
                format != null ? format.toLowerCase() : current.defaultFormat(),
                intOr(s, "gif_loop", current.gifLoopCount())));
    }

    private static void applyPool(OrchestratorConfig config, StageKind kind, Profile.Section s) {
        if (s == null)
            return;
        WorkerPoolConfig current = config.poolConfig(kind);
        String delay = opt(s, "downscale_delay_s");
        config.withPoolConfig(kind, new WorkerPoolConfig(
                intOr(s, "min_replicas", current.minReplicas()),
                intOr(s, "max_replicas", current.maxReplicas()),
                delay != null ? Duration.ofSeconds(Long.parseLong(delay)) : current.downscaleDelay()));
    }

    private static void applyMinio(OrchestratorConfig config, Profile.Section s) {
        if (s == null)
            return;
        config.withMinio(
                opt(s, "endpoint", config.minioEndpoint()),
                opt(s, "access_key", config.minioAccessKey()),
                opt(s, "secret_key", config.minioSecretKey()),
                opt(s, "bucket", config.minioBucket()));
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v != null ? v : def;
    }

    private static int intOr(Profile.Section s, String key, int def) {
        String v = opt(s, key);
        return v != null ? Integer.parseInt(v) : def;
    }
}
