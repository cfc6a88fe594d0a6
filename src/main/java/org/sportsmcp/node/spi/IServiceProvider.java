package org.sportsmcp.node.spi;

/**
 * Implemented by processes that other processes may {@code require}.
 * <p>
 * The exposed object is injected into the dependants' {@code dependencies} map under the key
 * used in their {@code require} block.
 */
public interface IServiceProvider {

    /**
     * @return the service handed to dependent processes, never {@code null}
     */
    Object getExposedService();
}
