package org.empiresim.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigUtil;
import org.empiresim.node.spi.IProcess;
import org.empiresim.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A running EmpireSim node. Builds the processes listed under {@code node.processes}, wires the services
 * they expose into the processes that {@code require} them and drives their lifecycle.
 *
 * <pre>
 * node.processes {
 *   engine { className = "...TickEngineProcess", options = ${empiresim} }
 *   http   { className = "...HttpServerProcess", require { engine = engine }, options { ... } }
 * }
 * </pre>
 */
public final class Node {

    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_CONFIG_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;
    private boolean running;

    /**
     * @param config The fully resolved application configuration.
     * @throws IllegalStateException if the process graph cannot be resolved.
     */
    public Node(final Config config) {
        try {
            initializeProcesses(config);
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to initialize the node: {}", e.getMessage());
            throw new IllegalStateException("Node initialization failed", e);
        }
    }

    /**
     * Starts the processes in dependency order and registers a shutdown hook.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        } else {
            LOGGER.info("\u001B[34m========== Management Interfaces ==========\u001B[0m");
            managedProcesses.forEach((name, process) -> {
                try {
                    LOGGER.debug("Starting process '{}'...", name);
                    process.start();
                } catch (final RuntimeException e) {
                    LOGGER.error("Failed to start process '{}': {}", name, e.getMessage());
                    LOGGER.debug("Start failure of process '{}'", name, e);
                }
            });
        }
        shutdownHook = new Thread(this::stop, "empiresim-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        running = true;
        LOGGER.info("Node started with {} process(es).", managedProcesses.size());
    }

    /**
     * Stops the processes, last started first. Safe to call more than once.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }

        LOGGER.info("\u001B[34m========== Management Interface Shutdown ==========\u001B[0m");
        final List<String> names = new ArrayList<>(managedProcesses.keySet());
        Collections.reverse(names);
        for (final String name : names) {
            try {
                LOGGER.debug("Stopping process '{}'...", name);
                managedProcesses.get(name).stop();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}': {}", name, e.getMessage());
                LOGGER.debug("Stop failure of process '{}'", name, e);
            }
        }
        LOGGER.info("All processes stopped.");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * @return Names of the managed processes in start order.
     */
    public List<String> getProcessNames() {
        return List.copyOf(managedProcesses.keySet());
    }

    public Optional<IProcess> getProcess(final String name) {
        return Optional.ofNullable(managedProcesses.get(name));
    }

    private void initializeProcesses(final Config config) {
        if (!config.hasPath(PROCESSES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_CONFIG_PATH);
            return;
        }
        final ConfigObject processesConfig = config.getObject(PROCESSES_CONFIG_PATH);

        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        for (final String name : processesConfig.keySet()) {
            final Config processConfig = processesConfig.toConfig().getConfig(quote(name));
            final Config options = processConfig.hasPath("options")
                ? processConfig.getConfig("options")
                : ConfigFactory.empty();
            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final ConfigObject require = processConfig.getObject("require");
                for (final String alias : require.keySet()) {
                    requires.put(alias, String.valueOf(require.get(alias).unwrapped()));
                }
            }
            definitions.put(name, new ProcessDefinition(name, processConfig.getString("className"), options, requires));
        }

        final List<String> order = resolveStartOrder(definitions);
        LOGGER.debug("Process start order: {}", order);

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String name : order) {
            final ProcessDefinition definition = definitions.get(name);
            final Map<String, Object> injected = new HashMap<>();
            boolean satisfied = true;
            for (final Map.Entry<String, String> requirement : definition.requires().entrySet()) {
                final Object service = exposedServices.get(requirement.getValue());
                if (service == null) {
                    LOGGER.error("Skipping process '{}': required process '{}' exposes no service",
                        name, requirement.getValue());
                    satisfied = false;
                    break;
                }
                injected.put(requirement.getKey(), service);
            }
            if (!satisfied) {
                continue;
            }

            final IProcess process;
            try {
                process = instantiate(definition, injected);
            } catch (final ReflectiveOperationException | RuntimeException e) {
                final Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.error("Failed to initialize process '{}': {}", name, cause.getMessage());
                LOGGER.debug("Initialization failure of process '{}'", name, cause);
                continue;
            }
            managedProcesses.put(name, process);
            if (process instanceof IServiceProvider provider && provider.getExposedService() != null) {
                exposedServices.put(name, provider.getExposedService());
            }
        }
        LOGGER.info("Initialized {} of {} process(es).", managedProcesses.size(), definitions.size());
    }

    private static IProcess instantiate(final ProcessDefinition definition, final Map<String, Object> dependencies)
        throws ReflectiveOperationException {
        final Class<?> processClass = Class.forName(definition.className());
        if (!IProcess.class.isAssignableFrom(processClass)) {
            throw new IllegalArgumentException("Class " + definition.className() + " does not implement IProcess.");
        }
        final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
        return (IProcess) constructor.newInstance(definition.name(), dependencies, definition.options());
    }

    /**
     * Kahn's algorithm over the {@code require} edges. Ties keep configuration order.
     *
     * @throws IllegalStateException on an unknown requirement or a cycle.
     */
    static List<String> resolveStartOrder(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Set<String>> dependents = new LinkedHashMap<>();
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        definitions.keySet().forEach(name -> {
            dependents.put(name, new LinkedHashSet<>());
            inDegree.put(name, 0);
        });
        for (final ProcessDefinition definition : definitions.values()) {
            for (final String required : definition.requires().values()) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + definition.name() + "' requires '" + required
                        + "' which is not configured.");
                }
                if (dependents.get(required).add(definition.name())) {
                    inDegree.merge(definition.name(), 1, Integer::sum);
                }
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });
        final List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String current = ready.poll();
            order.add(current);
            for (final String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != definitions.size()) {
            final List<String> cyclic = new ArrayList<>(definitions.keySet());
            cyclic.removeAll(order);
            throw new IllegalStateException("Circular dependency among processes: " + cyclic);
        }
        return order;
    }

    private static String quote(final String key) {
        return ConfigUtil.quoteString(key);
    }

    record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {
    }
}
