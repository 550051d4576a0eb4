package org.attrition.node.spi;

/**
 * A long-running part of the node with its own lifecycle.
 */
public interface IProcess {

    /**
     * Starts the process without blocking the caller.
     */
    void start();

    /**
     * Stops the process and releases what it holds.
     */
    void stop();
}
