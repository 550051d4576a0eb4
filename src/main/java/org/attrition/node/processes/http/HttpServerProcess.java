package org.attrition.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.attrition.engine.GameEngine;
import org.attrition.node.processes.AbstractProcess;
import org.attrition.node.spi.IController;
import org.attrition.node.spi.ServiceRegistry;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a Javalin server and mounts the controllers declared in the {@code routes} block:
 *
 * <pre>
 * routes {
 *   api {
 *     game {
 *       "$controller" { className = "org.attrition.node.processes.http.api.game.QueueController" }
 *     }
 *   }
 * }
 * </pre>
 *
 * The nesting of the keys gives the base path ({@code /api/game/}). A {@code $controller}
 * may also be a list, mounting several controllers at the same path. Requires the
 * {@link GameEngine} under the dependency name {@code engine}.
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);
    private static final String CONTROLLER_KEY = "$controller";

    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private final List<ControllerRoute> routes = new ArrayList<>();
    private Javalin app;

    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        controllerRegistry.register(GameEngine.class, getDependency("engine", GameEngine.class));
        if (options.hasPath("routes")) {
            collectRoutes(options.getObject("routes"), "/");
        } else {
            LOGGER.warn("No 'routes' block configured for '{}'. No routes will be served.", processName);
        }
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server '{}' is already running.", processName);
            return;
        }
        final String host = options.hasPath("network.host") ? options.getString("network.host") : "0.0.0.0";
        final int port = options.hasPath("network.port") ? options.getInt("network.port") : 8080;

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });
            final QueuedThreadPool threadPool = new QueuedThreadPool(
                intOption("network.threadPool.maxThreads", 200),
                intOption("network.threadPool.minThreads", 8),
                intOption("network.threadPool.idleTimeoutMs", 60000));
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;
        });

        for (final ControllerRoute route : routes) {
            createController(route).registerRoutes(app, route.basePath);
            LOGGER.debug("Mounted {} at {}", route.className, route.basePath);
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
     * @return the bound port, or -1 while stopped
     */
    public int getPort() {
        return app == null ? -1 : app.port();
    }

    private int intOption(final String path, final int fallback) {
        return options.hasPath(path) ? options.getInt(path) : fallback;
    }

    private void collectRoutes(final ConfigObject level, final String path) {
        for (final Map.Entry<String, ConfigValue> entry : level.entrySet()) {
            final ConfigValue value = entry.getValue();
            if (CONTROLLER_KEY.equals(entry.getKey())) {
                if (value.valueType() == ConfigValueType.LIST) {
                    for (final ConfigValue item : (ConfigList) value) {
                        addRoute(path, item);
                    }
                } else {
                    addRoute(path, value);
                }
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                collectRoutes((ConfigObject) value, path + entry.getKey() + "/");
            }
        }
    }

    private void addRoute(final String path, final ConfigValue value) {
        if (value.valueType() != ConfigValueType.OBJECT) {
            throw new IllegalArgumentException("Controller definition at " + path + " must be an object, got "
                + value.valueType());
        }
        final Config controller = ((ConfigObject) value).toConfig();
        routes.add(new ControllerRoute(path, controller.getString("className"),
            controller.hasPath("options") ? controller.getConfig("options") : ConfigFactory.empty()));
    }

    private IController createController(final ControllerRoute route) {
        try {
            final Class<?> type = Class.forName(route.className);
            if (!IController.class.isAssignableFrom(type)) {
                throw new IllegalStateException("Class " + route.className + " does not implement IController.");
            }
            final Constructor<?> constructor = type.getConstructor(ServiceRegistry.class, Config.class);
            return (IController) constructor.newInstance(controllerRegistry, route.options);
        } catch (final ReflectiveOperationException e) {
            LOGGER.error("Failed to create controller {} at {}", route.className, route.basePath);
            throw new IllegalStateException("Cannot create controller " + route.className, e);
        }
    }

    private static final class ControllerRoute {
        private final String basePath;
        private final String className;
        private final Config options;

        ControllerRoute(final String basePath, final String className, final Config options) {
            this.basePath = basePath;
            this.className = className;
            this.options = options;
        }
    }
}
