package mediagate.gpu.config;

import mediagate.gpu.api.internal.v1.CompletionController;
import mediagate.gpu.api.internal.v1.MetricsController;
import mediagate.gpu.api.v1.AdminController;
import mediagate.gpu.api.v1.DeviceController;
import mediagate.gpu.api.v1.HealthController;
import mediagate.gpu.api.v1.JobController;
import mediagate.gpu.api.v1.QueueController;
import mediagate.gpu.error.InsufficientCapacityException;
import mediagate.gpu.eviction.KindVramEstimator;
import mediagate.gpu.eviction.VramOptimizer;
import mediagate.gpu.eviction.VramRebalancer;
import mediagate.gpu.health.HealthMonitor;
import mediagate.gpu.ledger.AllocationLedger;
import mediagate.gpu.maintenance.MaintenanceScheduler;
import mediagate.gpu.maintenance.MetricsCollector;
import mediagate.gpu.maintenance.MetricsSource;
import mediagate.gpu.maintenance.QueueTimeoutReaper;
import mediagate.gpu.queue.PriorityJobQueue;
import mediagate.gpu.registry.DeviceRegistry;
import mediagate.gpu.repository.JobRepository;
import mediagate.gpu.scheduler.GpuScheduler;
import mediagate.gpu.scheduler.JobDispatcher;
import mediagate.gpu.scheduler.LoggingJobDispatcher;
import mediagate.gpu.server.RouterHandler;
import mediagate.gpu.store.InMemoryJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires all components once.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(GatewayConfig.fromEnv());
 * deps.startMaintenance(); // start background tasks
 * GpuScheduler scheduler = deps.scheduler();
 * // ... use components ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final GatewayConfig config;
    private final DeviceRegistry registry;
    private final AllocationLedger ledger;
    private final PriorityJobQueue queue;
    private final VramOptimizer optimizer;
    private final JobRepository jobRepository;
    private final JobDispatcher dispatcher;
    private final GpuScheduler scheduler;

    // Background tasks
    private final HealthMonitor healthMonitor;
    private final MetricsCollector metricsCollector;
    private final QueueTimeoutReaper queueTimeoutReaper;
    private final VramRebalancer rebalancer;
    private final boolean pollMetrics;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Maintenance scheduler (lazy-initialized)
    private MaintenanceScheduler maintenance;

    private Dependencies(GatewayConfig config, JobDispatcher dispatcher, MetricsSource metricsSource) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Capacity state
        this.registry = new DeviceRegistry(config.clock(), config.errorWindow());
        this.ledger = new AllocationLedger(config.memoryHeadroomBytes(), config.clock());
        this.queue = new PriorityJobQueue(config::queueCapacity);
        log.info("Queue capacities: {}", config.queueCapacities());
        this.optimizer = new VramOptimizer(ledger, config.clock());
        this.jobRepository = new InMemoryJobRepository();

        for (DeviceSpec spec : config.devices()) {
            registry.register(spec);
            ledger.addDevice(spec.id(), spec.totalVram());
            preloadModels(spec);
        }

        // Scheduler
        this.dispatcher = dispatcher;
        this.scheduler = new GpuScheduler(config, registry, ledger, queue, optimizer,
                new KindVramEstimator(config), jobRepository, dispatcher);
        registry.addListener(scheduler);

        // Background tasks
        this.healthMonitor = new HealthMonitor(registry, config);
        this.pollMetrics = metricsSource != null;
        this.metricsCollector = new MetricsCollector(registry,
                metricsSource != null ? metricsSource : List::of, config);
        this.queueTimeoutReaper = new QueueTimeoutReaper(queue, jobRepository, config);
        this.rebalancer = new VramRebalancer(registry, ledger, optimizer,
                config.rebalanceThreshold(), config.idleModelTtl(), config.clock());

        log.info("Dependencies initialized successfully ({} devices)", registry.size());
    }

    private void preloadModels(DeviceSpec spec) {
        for (ModelSpec model : config.residentModels()) {
            try {
                optimizer.loadModel(spec.id(), model.name(), model.vramBytes(), model.baseline());
            } catch (InsufficientCapacityException e) {
                log.warn("Model {} does not fit on device {}: {}", model.name(), spec.id(), e.getMessage());
            }
        }
    }

    /**
     * Create dependencies with the given config, dispatching to executors
     * that poll job status and receiving metrics by push only.
     */
    public static Dependencies create(GatewayConfig config) {
        return new Dependencies(config, new LoggingJobDispatcher(), null);
    }

    /**
     * @param metricsSource polled on the metrics interval, or null for push only
     */
    public static Dependencies create(GatewayConfig config, JobDispatcher dispatcher, MetricsSource metricsSource) {
        return new Dependencies(config, dispatcher, metricsSource);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(GatewayConfig.fromEnv());
    }

    // Getters
    public GatewayConfig config() {
        return config;
    }

    public DeviceRegistry registry() {
        return registry;
    }

    public AllocationLedger ledger() {
        return ledger;
    }

    public PriorityJobQueue queue() {
        return queue;
    }

    public VramOptimizer optimizer() {
        return optimizer;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public JobDispatcher dispatcher() {
        return dispatcher;
    }

    public GpuScheduler scheduler() {
        return scheduler;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public MetricsCollector metricsCollector() {
        return metricsCollector;
    }

    public QueueTimeoutReaper queueTimeoutReaper() {
        return queueTimeoutReaper;
    }

    public VramRebalancer rebalancer() {
        return rebalancer;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(scheduler))
                    .registerController(new DeviceController(scheduler))
                    .registerController(new QueueController(scheduler))
                    .registerController(new JobController(scheduler))
                    .registerController(new AdminController(scheduler))
                    .registerController(new CompletionController(scheduler))
                    .registerController(new MetricsController(metricsCollector));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the maintenance scheduler (creates it if not yet created).
     */
    public synchronized MaintenanceScheduler maintenance() {
        if (maintenance == null) {
            maintenance = new MaintenanceScheduler(healthMonitor, pollMetrics ? metricsCollector : null,
                    queueTimeoutReaper, rebalancer, config);
        }
        return maintenance;
    }

    /**
     * Start the background tasks. Should be called after server startup.
     */
    public void startMaintenance() {
        maintenance().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop background tasks first
        if (maintenance != null) {
            try {
                maintenance.stop();
            } catch (Exception e) {
                log.warn("Error stopping maintenance scheduler: {}", e.getMessage());
            }
        }

        int lost = scheduler.shutdown();
        log.info("Dependencies closed ({} reservations lost)", lost);
    }
}
