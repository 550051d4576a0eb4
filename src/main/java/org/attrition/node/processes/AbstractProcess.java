package org.attrition.node.processes;

import com.typesafe.config.Config;
import org.attrition.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for node processes. The node constructs every process with its name, the
 * services of the processes it requires, and its own {@code options} block.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    /**
     * Looks up a required dependency by the local name used in the {@code require} block.
     *
     * @throws IllegalArgumentException if it is missing or of another type
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final Object dependency = dependencies.get(name);
        if (dependency == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        if (!expectedType.isInstance(dependency)) {
            throw new IllegalArgumentException("Dependency '" + name + "' for process '" + processName + "' is "
                + dependency.getClass().getName() + " but expected " + expectedType.getName());
        }
        return expectedType.cast(dependency);
    }
}
