package org.empiresim.node.processes.http;

import com.typesafe.config.Config;
import org.empiresim.node.spi.IController;
import org.empiresim.node.spi.ServiceRegistry;

/**
 * Base class for controllers created by {@link HttpServerProcess}.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * @param registry Services shared by all controllers of the server.
     * @param options  The {@code options} block of the controller's route.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }
}
