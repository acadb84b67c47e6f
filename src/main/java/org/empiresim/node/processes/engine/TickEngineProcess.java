package org.empiresim.node.processes.engine;

import com.typesafe.config.Config;
import org.empiresim.engine.TickEngine;
import org.empiresim.node.processes.AbstractProcess;
import org.empiresim.node.spi.IServiceProvider;

import java.time.Clock;
import java.util.Map;

/**
 * Hosts the {@link TickEngine} inside a node and exposes it to processes that require it.
 * The options block is the {@code empiresim} configuration.
 */
public class TickEngineProcess extends AbstractProcess implements IServiceProvider {

    private final TickEngine engine;

    public TickEngineProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this(processName, dependencies, options, Clock.systemUTC());
    }

    TickEngineProcess(final String processName, final Map<String, Object> dependencies, final Config options,
                      final Clock clock) {
        super(processName, dependencies, options);
        this.engine = new TickEngine(options, clock);
    }

    @Override
    public void start() {
        engine.start();
    }

    @Override
    public void stop() {
        engine.stop();
    }

    @Override
    public TickEngine getExposedService() {
        return engine;
    }
}
