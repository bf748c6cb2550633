package vidloom;

import vidloom.orchestrator.config.Dependencies;
import vidloom.orchestrator.config.OrchestratorConfig;
import vidloom.orchestrator.server.OrchestratorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Wires dependencies, starts the HTTP server and background scheduler, and
 * shuts everything down on JVM exit.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        // Frames are rendered with java.awt.image, no display needed
        System.setProperty("java.awt.headless", "true");

        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        OrchestratorServer server = new OrchestratorServer(deps.routerHandler());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            try {
                server.stop();
            } finally {
                deps.close();
                stopped.countDown();
            }
        }, "vidloom-shutdown"));

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (RuntimeException e) {
            log.error("Failed to start server", e);
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();
        log.info("Vidloom orchestrator started on port {}", server.port());

        stopped.await();
    }
}
