package org.empiresim.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.empiresim.engine.api.processors.ITickProcessor;
import org.empiresim.engine.api.resources.IMonitorable;
import org.empiresim.engine.api.resources.IResource;
import org.empiresim.engine.api.resources.database.IOfflineSnapshotStore;
import org.empiresim.engine.api.resources.database.IPlayerTickStateStore;
import org.empiresim.engine.api.resources.database.ITickRecordStore;
import org.empiresim.engine.api.services.IService;
import org.empiresim.engine.players.OfflineSessionService;
import org.empiresim.engine.players.PlayerTickStateTracker;
import org.empiresim.engine.processors.ProcessorContext;
import org.empiresim.engine.resources.database.H2GameStateDatabase;
import org.empiresim.engine.resources.memory.InMemoryOfflineSnapshotStore;
import org.empiresim.engine.resources.memory.InMemoryPlayerTickStateStore;
import org.empiresim.engine.resources.memory.InMemoryTickRecordStore;
import org.empiresim.engine.scheduler.ProcessorRegistry;
import org.empiresim.engine.scheduler.SchedulerConfig;
import org.empiresim.engine.scheduler.TickSchedule;
import org.empiresim.engine.scheduler.TickScheduler;
import org.empiresim.engine.services.ScheduledTickService;
import org.empiresim.runtime.offline.ClampConfig;
import org.empiresim.runtime.probability.BreakthroughOdds;
import org.empiresim.runtime.probability.LobbyingOdds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the tick core of one node: stores, player tracker, processor registry, scheduler, offline
 * session handling, probability odds and the scheduled trigger.
 * <p>
 * Built once at startup from the {@code empiresim} configuration block:
 * <ul>
 *   <li>{@code engine.database}: {@code type = memory | h2} plus the H2 pool options.</li>
 *   <li>{@code engine.schedule}: epoch and tick interval.</li>
 *   <li>{@code engine.scheduler}: timeout, catch-up bound, worker pool.</li>
 *   <li>{@code engine.trigger}: {@code enabled} and {@code pollInterval} of the scheduled trigger.</li>
 *   <li>{@code engine.processors}: processors by name, each with {@code className} and {@code options}.</li>
 *   <li>{@code offline}: clamp tuning and {@code weeksPerMonth}.</li>
 *   <li>{@code probability}: resolver profiles.</li>
 * </ul>
 */
public class TickEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TickEngine.class);

    private final ITickRecordStore tickRecords;
    private final IPlayerTickStateStore playerStates;
    private final IOfflineSnapshotStore offlineSnapshots;
    private final PlayerTickStateTracker tracker;
    private final ProcessorRegistry processorRegistry;
    private final TickScheduler scheduler;
    private final OfflineSessionService offlineSessions;
    private final LobbyingOdds lobbyingOdds;
    private final BreakthroughOdds breakthroughOdds;
    private final ScheduledTickService scheduledTrigger;
    private final boolean triggerEnabled;
    private final AtomicBoolean started = new AtomicBoolean(false);

    /**
     * @param config The {@code empiresim} configuration block.
     * @param clock  Wall clock of the node.
     */
    public TickEngine(Config config, Clock clock) {
        Config engine = config.getConfig("engine");
        Config database = engine.hasPath("database") ? engine.getConfig("database") : ConfigFactory.empty();
        String databaseType = database.hasPath("type") ? database.getString("type") : "memory";

        if ("memory".equals(databaseType)) {
            this.tickRecords = new InMemoryTickRecordStore("tick-records", database);
            this.playerStates = new InMemoryPlayerTickStateStore("player-states", database);
            this.offlineSnapshots = new InMemoryOfflineSnapshotStore("offline-snapshots", database);
        } else if ("h2".equals(databaseType)) {
            H2GameStateDatabase h2 = new H2GameStateDatabase("game-state-db", database);
            this.tickRecords = h2;
            this.playerStates = h2;
            this.offlineSnapshots = h2;
        } else {
            throw new IllegalArgumentException("Unknown database type '" + databaseType + "', expected 'memory' or 'h2'");
        }

        Config offline = config.getConfig("offline");
        ClampConfig clampConfig = ClampConfig.fromConfig(offline.getConfig("clamp"));
        int weeksPerMonth = offline.hasPath("weeksPerMonth") ? offline.getInt("weeksPerMonth") : 4;
        Config probability = config.getConfig("probability");
        this.lobbyingOdds = LobbyingOdds.fromConfig(probability);
        this.breakthroughOdds = BreakthroughOdds.fromConfig(probability);

        this.tracker = new PlayerTickStateTracker(playerStates, clock);
        this.processorRegistry = new ProcessorRegistry();
        ProcessorContext context = new ProcessorContext(tracker, lobbyingOdds, offlineSnapshots, clampConfig, weeksPerMonth);
        if (engine.hasPath("processors")) {
            instantiateProcessors(engine.getObject("processors"), context);
        }

        this.scheduler = new TickScheduler(tickRecords, tracker, processorRegistry,
            TickSchedule.fromConfig(engine.getConfig("schedule")),
            SchedulerConfig.fromConfig(engine.hasPath("scheduler") ? engine.getConfig("scheduler") : ConfigFactory.empty()),
            clock);
        this.offlineSessions = new OfflineSessionService(offlineSnapshots, scheduler, clampConfig, weeksPerMonth, clock);

        Config trigger = engine.hasPath("trigger") ? engine.getConfig("trigger") : ConfigFactory.empty();
        this.triggerEnabled = !trigger.hasPath("enabled") || trigger.getBoolean("enabled");
        this.scheduledTrigger = new ScheduledTickService("scheduled-trigger", trigger, scheduler);

        log.debug("Tick engine initialized: database={}, processors={}", databaseType,
            processorRegistry.getActiveProcessors().stream().map(ITickProcessor::getName).toList());
    }

    private void instantiateProcessors(ConfigObject processors, ProcessorContext context) {
        for (String name : processors.keySet()) {
            Config processorConfig = processors.toConfig().getConfig(name);
            String className = processorConfig.getString("className");
            Config options = processorConfig.hasPath("options") ? processorConfig.getConfig("options") : ConfigFactory.empty();
            try {
                Class<?> processorClass = Class.forName(className);
                if (!ITickProcessor.class.isAssignableFrom(processorClass)) {
                    throw new IllegalArgumentException("Class " + className + " does not implement ITickProcessor.");
                }
                Constructor<?> constructor = processorClass.getConstructor(String.class, Config.class, ProcessorContext.class);
                processorRegistry.register((ITickProcessor) constructor.newInstance(name, options, context));
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Failed to create processor '{}': {}", name, cause.getMessage());
                throw new IllegalStateException("Failed to create processor '" + name + "'", cause);
            } catch (ReflectiveOperationException e) {
                log.error("Failed to create processor '{}' of class '{}': {}", name, className, e.getMessage());
                throw new IllegalStateException("Failed to create processor '" + name + "'", e);
            }
        }
    }

    /**
     * Registers a processor in addition to the configured ones.
     *
     * @return {@code true} if the processor passed validation.
     */
    public boolean registerProcessor(ITickProcessor processor) {
        return processorRegistry.register(processor);
    }

    /**
     * Starts the scheduled trigger if enabled. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (triggerEnabled) {
            scheduledTrigger.start();
        } else {
            log.info("Scheduled trigger disabled, ticks run on manual trigger only");
        }
        log.info("Tick engine started at {}", scheduler.getCurrentGameTime());
    }

    /**
     * Stops the trigger, the worker pool and closes the database.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        IService.State state = scheduledTrigger.getCurrentState();
        if (state == IService.State.RUNNING || state == IService.State.PAUSED) {
            scheduledTrigger.stop();
        }
        close();
        log.info("Tick engine stopped");
    }

    @Override
    public void close() {
        scheduler.close();
        if (tickRecords instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close tick record store: {}", e.getMessage());
            }
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * @return Metrics of the trigger service and of the stores, keyed by component name.
     */
    public Map<String, Map<String, Number>> getMetrics() {
        Map<String, Map<String, Number>> metrics = new LinkedHashMap<>();
        metrics.put("scheduled-trigger", scheduledTrigger.getMetrics());
        addResourceMetrics(metrics, tickRecords);
        addResourceMetrics(metrics, playerStates);
        addResourceMetrics(metrics, offlineSnapshots);
        return metrics;
    }

    private static void addResourceMetrics(Map<String, Map<String, Number>> metrics, Object resource) {
        if (resource instanceof IMonitorable monitorable && resource instanceof IResource named) {
            metrics.putIfAbsent(named.getResourceName(), monitorable.getMetrics());
        }
    }

    public TickScheduler getScheduler() {
        return scheduler;
    }

    public PlayerTickStateTracker getTracker() {
        return tracker;
    }

    public ProcessorRegistry getProcessorRegistry() {
        return processorRegistry;
    }

    public OfflineSessionService getOfflineSessions() {
        return offlineSessions;
    }

    public LobbyingOdds getLobbyingOdds() {
        return lobbyingOdds;
    }

    public BreakthroughOdds getBreakthroughOdds() {
        return breakthroughOdds;
    }

    public ScheduledTickService getScheduledTrigger() {
        return scheduledTrigger;
    }

    public ITickRecordStore getTickRecords() {
        return tickRecords;
    }
}
