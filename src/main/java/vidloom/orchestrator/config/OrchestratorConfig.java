package vidloom.orchestrator.config;

import vidloom.orchestrator.pipeline.ProgressBudgets;
import vidloom.orchestrator.pipeline.StageKind;
import vidloom.orchestrator.stage.PostprocessorSettings;
import vidloom.orchestrator.stage.PreprocessorSettings;
import vidloom.orchestrator.worker.WorkerPoolConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration holder for the orchestrator.
 * All settings have sensible defaults; environment variables and an optional
 * INI file (see {@link IniConfigLoader}) override them.
 */
public final class OrchestratorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/vidloom;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Pipeline settings
    private Path outputDir = Path.of("outputs");
    private int maxConcurrentJobs = 4;
    private ProgressBudgets progressBudgets = ProgressBudgets.defaults();
    private PreprocessorSettings preprocessorSettings = PreprocessorSettings.defaults();
    private PostprocessorSettings postprocessorSettings = PostprocessorSettings.defaults();

    // Worker pool settings
    private final Map<StageKind, WorkerPoolConfig> poolConfigs = new EnumMap<>(StageKind.class);
    private Duration poolReapInterval = Duration.ofSeconds(30);

    // Object storage settings
    private String minioEndpoint = "http://localhost:9000";
    private String minioAccessKey = "minioadmin";
    private String minioSecretKey = "minioadmin";
    private String minioBucket = "videos";

    private OrchestratorConfig() {
        poolConfigs.put(StageKind.PREPROCESS, WorkerPoolConfig.of(1, 3));
        poolConfigs.put(StageKind.GENERATE, WorkerPoolConfig.of(1, 1));
        poolConfigs.put(StageKind.INTERPOLATE, WorkerPoolConfig.of(1, 5));
        poolConfigs.put(StageKind.UPSCALE, WorkerPoolConfig.of(1, 4));
        poolConfigs.put(StageKind.POSTPROCESS, WorkerPoolConfig.of(1, 3));
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    /**
     * Defaults, then environment variables, then the INI file named by
     * {@code VIDLOOM_CONFIG} if set.
     */
    public static OrchestratorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static OrchestratorConfig fromEnv(Map<String, String> env) {
        OrchestratorConfig config = new OrchestratorConfig();

        String dbUrl = env.get("VIDLOOM_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("VIDLOOM_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String outputDir = env.get("VIDLOOM_OUTPUT_DIR");
        if (outputDir != null && !outputDir.isBlank()) {
            config.outputDir = Path.of(outputDir);
        }

        String endpoint = env.get("VIDLOOM_MINIO_ENDPOINT");
        if (endpoint != null && !endpoint.isBlank()) {
            config.minioEndpoint = endpoint;
        }

        String accessKey = env.get("VIDLOOM_MINIO_ACCESS_KEY");
        if (accessKey != null && !accessKey.isBlank()) {
            config.minioAccessKey = accessKey;
        }

        String secretKey = env.get("VIDLOOM_MINIO_SECRET_KEY");
        if (secretKey != null && !secretKey.isBlank()) {
            config.minioSecretKey = secretKey;
        }

        String bucket = env.get("VIDLOOM_MINIO_BUCKET");
        if (bucket != null && !bucket.isBlank()) {
            config.minioBucket = bucket;
        }

        String iniFile = env.get("VIDLOOM_CONFIG");
        if (iniFile != null && !iniFile.isBlank()) {
            IniConfigLoader.apply(config, Path.of(iniFile));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Path outputDir() {
        return outputDir;
    }

    public int maxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public ProgressBudgets progressBudgets() {
        return progressBudgets;
    }

    public PreprocessorSettings preprocessorSettings() {
        return preprocessorSettings;
    }

    public PostprocessorSettings postprocessorSettings() {
        return postprocessorSettings;
    }

    /** Frame rate the core generator renders at. */
    public int baseFps() {
        return preprocessorSettings.baseFps();
    }

    public WorkerPoolConfig poolConfig(StageKind kind) {
        return poolConfigs.get(kind);
    }

    public Duration poolReapInterval() {
        return poolReapInterval;
    }

    public String minioEndpoint() {
        return minioEndpoint;
    }

    public String minioAccessKey() {
        return minioAccessKey;
    }

    public String minioSecretKey() {
        return minioSecretKey;
    }

    public String minioBucket() {
        return minioBucket;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public OrchestratorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withOutputDir(Path dir) {
        this.outputDir = dir;
        return this;
    }

    public OrchestratorConfig withMaxConcurrentJobs(int jobs) {
        if (jobs < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be at least 1");
        }
        this.maxConcurrentJobs = jobs;
        return this;
    }

    public OrchestratorConfig withProgressBudgets(ProgressBudgets budgets) {
        this.progressBudgets = budgets;
        return this;
    }

    public OrchestratorConfig withPreprocessorSettings(PreprocessorSettings settings) {
        this.preprocessorSettings = settings;
        return this;
    }

    public OrchestratorConfig withPostprocessorSettings(PostprocessorSettings settings) {
        this.postprocessorSettings = settings;
        return this;
    }

    public OrchestratorConfig withPoolConfig(StageKind kind, WorkerPoolConfig poolConfig) {
        this.poolConfigs.put(kind, poolConfig);
        return this;
    }

    public OrchestratorConfig withPoolReapInterval(Duration interval) {
        this.poolReapInterval = interval;
        return this;
    }

    public OrchestratorConfig withMinio(String endpoint, String accessKey, String secretKey, String bucket) {
        this.minioEndpoint = endpoint;
        this.minioAccessKey = accessKey;
        this.minioSecretKey = secretKey;
        this.minioBucket = bucket;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", outputDir=" + outputDir +
                ", maxConcurrentJobs=" + maxConcurrentJobs +
                ", budgets=" + progressBudgets +
                ", minio='" + minioEndpoint + "/" + minioBucket + '\'' +
                '}';
    }
}
