package fr.lapetina.failover;

import fr.lapetina.failover.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Origin Failover Router.
 */
public class FailoverRouterApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FailoverRouterApplication.class);

    private final RouterFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public FailoverRouterApplication(RouterFactory factory) throws Exception {
        log.info("Starting Origin Failover Router...");

        this.factory = factory;
        this.httpServer = new HttpServer(
                factory.getConfig().getServer(),
                factory.getController(),
                factory.getMetricsRegistry()
        );

        log.info("Origin Failover Router initialized");
    }

    public FailoverRouterApplication(String configPath) throws Exception {
        this(RouterFactory.create(configPath));
    }

    public void start() {
        httpServer.start();
        log.info("Origin Failover Router started on port {}", httpServer.getPort());
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    @Override
    public void close() {
        log.info("Shutting down Origin Failover Router...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Origin Failover Router shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            FailoverRouterApplication app = new FailoverRouterApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Origin Failover Router", e);
            System.exit(1);
        }
    }
}
