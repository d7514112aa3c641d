package mediagate;

import mediagate.gpu.config.Dependencies;
import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.server.GatewayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Gateway entry point.
 *
 * Wires the components, starts the HTTP server, then the background tasks,
 * and blocks until the JVM shuts down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        GatewayConfig config = GatewayConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        GatewayServer server = new GatewayServer(deps.routerHandler());

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (RuntimeException e) {
            log.error("Gateway failed to start", e);
            deps.close();
            System.exit(1);
            return;
        }
        deps.startMaintenance();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gateway...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "mediagate-shutdown"));

        stopped.await();
    }
}
