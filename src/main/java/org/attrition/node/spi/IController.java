package org.attrition.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP controller mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers the controller's routes and exception handlers.
     *
     * @param app      the Javalin application
     * @param basePath path prefix ending with {@code /}
     */
    void registerRoutes(Javalin app, String basePath);
}
