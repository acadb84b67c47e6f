package org.empiresim.node.processes;

import com.typesafe.config.Config;
import org.empiresim.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for node processes. Every process is built by {@link org.empiresim.node.Node} through the
 * {@code (String, Map, Config)} constructor with the processes it declared under {@code require}.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  Name of the process in {@code node.processes}.
     * @param dependencies Required processes by their local alias.
     * @param options      The {@code options} block of this process.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * Looks up a required dependency.
     *
     * @throws IllegalArgumentException if the alias is not bound or the bound process has another type.
     */
    protected <T> T getDependency(final String alias, final Class<T> expectedType) {
        final Object dependency = dependencies.get(alias);
        if (dependency == null) {
            throw new IllegalArgumentException(
                "Process '" + processName + "' requires '" + alias + "' but it is not bound");
        }
        if (!expectedType.isInstance(dependency)) {
            throw new IllegalArgumentException("Dependency '" + alias + "' of process '" + processName + "' is "
                + dependency.getClass().getName() + ", expected " + expectedType.getName());
        }
        return expectedType.cast(dependency);
    }
}
