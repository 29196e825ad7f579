package automihomo.control.config;

import automihomo.control.api.v1.HealthController;
import automihomo.control.api.v1.NodesController;
import automihomo.control.api.v1.StatusController;
import automihomo.control.api.v1.SwitchController;
import automihomo.control.api.v1.UpdateController;
import automihomo.control.engine.EngineClient;
import automihomo.control.engine.HttpEngineClient;
import automihomo.control.scheduler.Scheduler;
import automihomo.control.server.RouterHandler;
import automihomo.control.service.NodeService;
import automihomo.control.service.PipelineRunner;
import automihomo.control.service.UpdateOrchestrator;
import automihomo.control.service.UpdatePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ControlConfig.fromEnv());
 * ControlServer server = new ControlServer(host, port, deps.routerHandler());
 * deps.startScheduler(); // start periodic updates
 * // ... serve ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ControlConfig config;
    private final EngineClient engineClient;
    private final UpdatePipeline pipeline;
    private final NodeService nodeService;
    private final UpdateOrchestrator orchestrator;

    // Controllers
    private final UpdateController updateController;
    private final StatusController statusController;
    private final SwitchController switchController;
    private final NodesController nodesController;
    private final HealthController healthController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(ControlConfig config, EngineClient engineClient, UpdatePipeline pipeline) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Adapters
        this.engineClient = engineClient;
        this.pipeline = pipeline;

        // Services
        this.nodeService = new NodeService(engineClient);
        this.orchestrator = new UpdateOrchestrator(pipeline);

        // Controllers
        this.updateController = new UpdateController(orchestrator);
        this.statusController = new StatusController(orchestrator);
        this.switchController = new SwitchController(nodeService);
        this.nodesController = new NodesController(nodeService);
        this.healthController = new HealthController(nodeService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(ControlConfig config) {
        EngineClient engine = new HttpEngineClient(
                config.engineApiBase(), config.engineSecret(), config.engineRequestTimeout());
        UpdatePipeline pipeline = new PipelineRunner(
                config.pipelineCommand(), config.pipelineWorkDir(),
                config.pipelineTimeout(), config.outputTailChars());
        return create(config, engine, pipeline);
    }

    /**
     * Create dependencies with explicit adapters (tests substitute fakes here).
     */
    public static Dependencies create(ControlConfig config, EngineClient engineClient, UpdatePipeline pipeline) {
        return new Dependencies(config, engineClient, pipeline);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(ControlConfig.fromEnv());
    }

    // Getters
    public ControlConfig config() {
        return config;
    }

    public EngineClient engineClient() {
        return engineClient;
    }

    public UpdatePipeline pipeline() {
        return pipeline;
    }

    public NodeService nodeService() {
        return nodeService;
    }

    public UpdateOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(updateController)
                    .registerController(statusController)
                    .registerController(switchController)
                    .registerController(nodesController)
                    .registerController(healthController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(orchestrator, config.updateInterval());
        }
        return scheduler;
    }

    /**
     * Start periodic updates; a no-op when the interval is not positive.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first so no new run is triggered
        Scheduler s;
        synchronized (this) {
            s = scheduler;
        }
        if (s != null) {
            try {
                s.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error stopping update orchestrator: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
