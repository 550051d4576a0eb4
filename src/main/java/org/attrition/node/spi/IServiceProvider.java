package org.attrition.node.spi;

/**
 * A process that hands one service object to the processes that {@code require} it.
 */
public interface IServiceProvider {

    /**
     * @return the exposed service, or {@code null} if nothing is exposed
     */
    Object getExposedService();
}
