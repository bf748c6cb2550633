package vidloom.orchestrator.config;

import vidloom.orchestrator.api.v1.HealthController;
import vidloom.orchestrator.api.v1.JobController;
import vidloom.orchestrator.pipeline.PipelineOrchestrator;
import vidloom.orchestrator.pipeline.StagePools;
import vidloom.orchestrator.repository.JobRepository;
import vidloom.orchestrator.scheduler.Scheduler;
import vidloom.orchestrator.server.RouterHandler;
import vidloom.orchestrator.service.GenerationRequestConverter;
import vidloom.orchestrator.service.JobDispatcher;
import vidloom.orchestrator.service.JobService;
import vidloom.orchestrator.storage.MinioObjectStore;
import vidloom.orchestrator.storage.ObjectStore;
import vidloom.orchestrator.store.Database;
import vidloom.orchestrator.store.JdbcJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startScheduler(); // start background tasks
 * JobService jobService = deps.jobService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final ObjectStore objectStore;
    private final StagePools stagePools;
    private final PipelineOrchestrator orchestrator;
    private final JobDispatcher dispatcher;
    private final JobService jobService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(OrchestratorConfig config, ObjectStore objectStore) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.objectStore = objectStore != null ? objectStore : new MinioObjectStore(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);

        // Pipeline
        this.stagePools = StagePools.create(config, jobRepository);
        this.orchestrator = new PipelineOrchestrator(jobRepository, stagePools, this.objectStore, config);
        this.dispatcher = new JobDispatcher(orchestrator, config.maxConcurrentJobs());

        // Services
        this.jobService = new JobService(jobRepository, dispatcher, new GenerationRequestConverter());

        // Controllers
        this.healthController = new HealthController(database, stagePools, this.objectStore);
        this.jobController = new JobController(jobService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, storing videos in MinIO.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config, null);
    }

    /**
     * Create dependencies with the given config and object store.
     */
    public static Dependencies create(OrchestratorConfig config, ObjectStore objectStore) {
        return new Dependencies(config, objectStore);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public ObjectStore objectStore() {
        return objectStore;
    }

    public StagePools stagePools() {
        return stagePools;
    }

    public PipelineOrchestrator orchestrator() {
        return orchestrator;
    }

    public JobDispatcher dispatcher() {
        return dispatcher;
    }

    public JobService jobService() {
        return jobService;
    }

    public HealthController healthController() {
        return healthController;
    }

    public JobController jobController() {
        return jobController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(stagePools, config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        // Running pipelines finish or time out before their pools go away
        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error stopping dispatcher: {}", e.getMessage());
        }

        stagePools.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
