package mediagate.gpu.maintenance;

import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.eviction.VramRebalancer;
import mediagate.gpu.health.HealthMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the periodic background tasks:
 * - health sweep
 * - metrics collection (when a metrics source is configured)
 * - queue timeout reaper
 * - VRAM rebalancer
 *
 * Uses a single-threaded executor so the tasks never overlap each other.
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ScheduledExecutorService executor;
    private final HealthMonitor healthMonitor;
    private final MetricsCollector metricsCollector;
    private final QueueTimeoutReaper queueTimeoutReaper;
    private final VramRebalancer rebalancer;
    private final GatewayConfig config;

    private volatile boolean running = false;

    /**
     * @param metricsCollector may be null when metrics only arrive by push
     */
    public MaintenanceScheduler(HealthMonitor healthMonitor, MetricsCollector metricsCollector,
            QueueTimeoutReaper queueTimeoutReaper, VramRebalancer rebalancer, GatewayConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mediagate-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.healthMonitor = healthMonitor;
        this.metricsCollector = metricsCollector;
        this.queueTimeoutReaper = queueTimeoutReaper;
        this.rebalancer = rebalancer;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Maintenance scheduler already running");
            return;
        }

        running = true;

        schedule("health-monitor", healthMonitor, config.healthCheckInterval());
        if (metricsCollector != null) {
            schedule("metrics-collector", metricsCollector, config.metricsInterval());
        }
        schedule("queue-timeout-reaper", queueTimeoutReaper, config.queueTimeoutReaperInterval());
        schedule("vram-rebalancer", rebalancer, config.rebalanceInterval());

        log.info("Maintenance scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Maintenance scheduler forcefully stopped");
            } else {
                log.info("Maintenance scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long ms = interval.toMillis();
        executor.scheduleAtFixedRate(wrapRunnable(name, task), ms, ms, TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, ms);
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
