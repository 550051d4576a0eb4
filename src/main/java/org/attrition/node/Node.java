package org.attrition.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.attrition.node.spi.IProcess;
import org.attrition.node.spi.IServiceProvider;
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
import java.util.Set;

/**
 * Hosts the processes configured under {@code node.processes}.
 *
 * <pre>
 * node.processes {
 *   engine { className = "...GameEngineProcess", options { ... } }
 *   http   { className = "...HttpServerProcess", require { engine = "engine" }, options { ... } }
 * }
 * </pre>
 *
 * Processes are created so that every process comes after the ones it {@code require}s, and
 * stopped in reverse order. The service a provider exposes is injected into its dependents
 * under the local name of the {@code require} entry.
 */
public final class Node {

    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_PATH = "node.processes";

    private final Map<String, IProcess> processes = new LinkedHashMap<>();
    private Thread shutdownHook;

    /**
     * @throws IllegalStateException if a process cannot be created or dependencies form a cycle
     */
    public Node(final Config config) {
        if (!config.hasPath(PROCESSES_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_PATH);
            return;
        }
        final Map<String, ProcessDefinition> definitions = parse(config.getObject(PROCESSES_PATH));
        final Map<String, Object> exposed = new HashMap<>();
        for (final String name : topologicalOrder(definitions)) {
            final ProcessDefinition definition = definitions.get(name);
            final IProcess process = instantiate(definition, resolveDependencies(definition, exposed));
            processes.put(name, process);
            if (process instanceof IServiceProvider) {
                final Object service = ((IServiceProvider) process).getExposedService();
                if (service != null) {
                    exposed.put(name, service);
                }
            }
        }
        LOGGER.info("Initialized {} process(es): {}", processes.size(), processes.keySet());
    }

    public void start() {
        if (processes.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        for (final Map.Entry<String, IProcess> entry : processes.entrySet()) {
            LOGGER.debug("Starting process '{}'", entry.getKey());
            entry.getValue().start();
        }
        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started.");
    }

    /**
     * Stops all processes, last created first. Failures are logged and do not stop the others.
     */
    public synchronized void stop() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Shutdown already in progress: {}", e.getMessage());
            }
            shutdownHook = null;
        }
        final List<String> names = new ArrayList<>(processes.keySet());
        Collections.reverse(names);
        for (final String name : names) {
            try {
                processes.get(name).stop();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}': {}", name, e.getMessage());
                LOGGER.debug("Stop failure details:", e);
            }
        }
        LOGGER.info("All processes stopped.");
    }

    /**
     * @return the process with the given name, or {@code null}
     */
    public IProcess getProcess(final String name) {
        return processes.get(name);
    }

    private static Map<String, ProcessDefinition> parse(final ConfigObject processesConfig) {
        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        final Config all = processesConfig.toConfig();
        for (final String name : processesConfig.keySet()) {
            final Config processConfig = all.getConfig(name);
            final Config options = processConfig.hasPath("options")
                ? processConfig.getConfig("options")
                : ConfigFactory.empty();
            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final Config require = processConfig.getConfig("require");
                for (final String localName : processConfig.getObject("require").keySet()) {
                    requires.put(localName, require.getString(localName));
                }
            }
            definitions.put(name, new ProcessDefinition(name, processConfig.getString("className"), options, requires));
        }
        return definitions;
    }

    /**
     * Kahn's algorithm over the {@code require} edges, keeping configuration order among
     * independent processes.
     */
    static List<String> topologicalOrder(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        final Map<String, Set<String>> dependents = new HashMap<>();
        for (final String name : definitions.keySet()) {
            inDegree.put(name, 0);
            dependents.put(name, new LinkedHashSet<>());
        }
        for (final ProcessDefinition definition : definitions.values()) {
            for (final String required : definition.requires.values()) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + definition.name + "' requires '" + required
                        + "' which is not configured.");
                }
                dependents.get(required).add(definition.name);
                inDegree.merge(definition.name, 1, Integer::sum);
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
            throw new IllegalStateException("Circular dependency detected among processes: " + cyclic);
        }
        return order;
    }

    private static Map<String, Object> resolveDependencies(final ProcessDefinition definition,
                                                           final Map<String, Object> exposed) {
        final Map<String, Object> injected = new HashMap<>();
        definition.requires.forEach((localName, source) -> {
            final Object service = exposed.get(source);
            if (service == null) {
                throw new IllegalStateException("Process '" + definition.name + "' requires a service from '"
                    + source + "' but it exposes none.");
            }
            injected.put(localName, service);
        });
        return injected;
    }

    private static IProcess instantiate(final ProcessDefinition definition, final Map<String, Object> dependencies) {
        try {
            final Class<?> type = Class.forName(definition.className);
            if (!IProcess.class.isAssignableFrom(type)) {
                throw new IllegalStateException("Class " + definition.className + " does not implement IProcess.");
            }
            final Constructor<?> constructor = type.getConstructor(String.class, Map.class, Config.class);
            return (IProcess) constructor.newInstance(definition.name, dependencies, definition.options);
        } catch (final ReflectiveOperationException e) {
            LOGGER.error("Failed to create process '{}' ({})", definition.name, definition.className);
            throw new IllegalStateException("Cannot create process '" + definition.name + "'", e);
        }
    }

    static final class ProcessDefinition {
        final String name;
        final String className;
        final Config options;
        final Map<String, String> requires;

        ProcessDefinition(final String name, final String className, final Config options,
                          final Map<String, String> requires) {
            this.name = name;
            this.className = className;
            this.options = options;
            this.requires = requires;
        }
    }
}
