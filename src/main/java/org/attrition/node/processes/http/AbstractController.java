package org.attrition.node.processes.http;

import com.typesafe.config.Config;
import org.attrition.node.spi.IController;
import org.attrition.node.spi.ServiceRegistry;

/**
 * Base class for controllers. The HTTP server process creates controllers reflectively
 * through the {@code (ServiceRegistry, Config)} constructor.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }
}
