package org.empiresim.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.empiresim.engine.TickEngine;
import org.empiresim.engine.scheduler.TickScheduler;
import org.empiresim.node.processes.AbstractProcess;
import org.empiresim.node.spi.IController;
import org.empiresim.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a Javalin HTTP server whose controllers are mounted from the {@code routes} block.
 * Nested keys form the path; a {@code "$controller"} entry mounts a controller at that path:
 *
 * <pre>
 * routes {
 *   api {
 *     tick { "$controller" { className = "org.empiresim.node.processes.http.api.tick.TickController" } }
 *   }
 * }
 * </pre>
 *
 * Requires the {@code engine} dependency.
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);
    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_KEY = "$controller";

    private final List<ControllerRoute> controllerRoutes = new ArrayList<>();
    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private Javalin app;

    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        final TickEngine engine = getDependency("engine", TickEngine.class);
        controllerRegistry.register(TickEngine.class, engine);
        controllerRegistry.register(TickScheduler.class, engine.getScheduler());

        if (options.hasPath(ROUTES_CONFIG_KEY)) {
            parseConfigLevel(options.getConfig(ROUTES_CONFIG_KEY).root(), "/");
        } else {
            LOGGER.warn("No '{}' block found for '{}'. No routes will be served.", ROUTES_CONFIG_KEY, processName);
        }
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server '{}' is already running.", processName);
            return;
        }
        final String host = options.getString("network.host");
        final int port = options.getInt("network.port");

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });
            final int minThreads = intOption("network.threadPool.minThreads", 8);
            final int maxThreads = intOption("network.threadPool.maxThreads", 200);
            final int idleTimeout = intOption("network.threadPool.idleTimeoutMs", 60000);
            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeout);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;
        });

        for (final ControllerRoute route : controllerRoutes) {
            registerController(route, app);
        }

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return The bound port, or -1 if the server is not running.
     */
    public int getPort() {
        return app == null ? -1 : app.port();
    }

    private int intOption(final String path, final int fallback) {
        return options.hasPath(path) ? options.getInt(path) : fallback;
    }

    private void parseConfigLevel(final ConfigObject level, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : level.entrySet()) {
            final ConfigValue value = entry.getValue();
            if (CONTROLLER_KEY.equals(entry.getKey())) {
                if (value.valueType() == ConfigValueType.OBJECT) {
                    controllerRoutes.add(new ControllerRoute(currentPath, ((ConfigObject) value).toConfig()));
                } else {
                    LOGGER.error("Invalid '{}' at path '{}', expected an object.", CONTROLLER_KEY, currentPath);
                }
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                parseConfigLevel((ConfigObject) value, (currentPath + entry.getKey() + "/").replaceAll("//", "/"));
            }
        }
    }

    private void registerController(final ControllerRoute route, final Javalin javalin) {
        final String className = route.config().getString("className");
        final Config controllerOptions = route.config().hasPath("options")
            ? route.config().getConfig("options")
            : ConfigFactory.empty();
        try {
            final Class<?> controllerClass = Class.forName(className);
            if (!IController.class.isAssignableFrom(controllerClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IController.");
            }
            final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
            final IController controller = (IController) constructor.newInstance(controllerRegistry, controllerOptions);
            controller.registerRoutes(javalin, route.basePath());
            LOGGER.debug("Mounted controller '{}' at '{}'", className, route.basePath());
        } catch (final ReflectiveOperationException | RuntimeException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOGGER.error("Failed to register controller '{}' at path '{}': {}", className, route.basePath(), cause.getMessage());
        }
    }

    private record ControllerRoute(String basePath, Config config) {
    }
}
