package org.sportsmcp.node.spi;

/**
 * A long-running component managed by the {@link org.sportsmcp.node.Node}.
 * <p>
 * Implementations must provide a public constructor with the signature
 * {@code (String processName, Map<String, Object> dependencies, Config options)}; the node
 * instantiates them reflectively from the {@code node.processes} configuration.
 */
public interface IProcess {

    /**
     * Starts the process. Called once, after every required process has been started.
     */
    void start();

    /**
     * Stops the process and releases its resources. Called once, in reverse start order.
     */
    void stop();
}
