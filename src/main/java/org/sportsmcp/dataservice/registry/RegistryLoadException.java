package org.sportsmcp.dataservice.registry;

/**
 * Thrown when the dataset registry cannot be loaded.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>Registry directory missing or unreadable</li>
 *   <li>Descriptor file that is not valid JSON</li>
 *   <li>Descriptor without {@code dataset_id}, {@code schema}, {@code table} or columns</li>
 *   <li>The same {@code dataset_id} declared by two files</li>
 *   <li>No descriptor files at all</li>
 * </ul>
 * <p>
 * This is a RuntimeException because a broken registry is a deployment problem the process
 * cannot recover from. The node must not start serving requests when it is thrown.
 */
public class RegistryLoadException extends RuntimeException {

    /**
     * @param message description of the load failure
     */
    public RegistryLoadException(String message) {
        super(message);
    }

    /**
     * @param message description of the load failure
     * @param cause   the underlying exception
     */
    public RegistryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
