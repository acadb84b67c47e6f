package org.empiresim.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP controller mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers the controller's routes.
     *
     * @param app      The Javalin application.
     * @param basePath Path under which the routes are nested, always ending with a slash.
     */
    void registerRoutes(Javalin app, String basePath);
}
