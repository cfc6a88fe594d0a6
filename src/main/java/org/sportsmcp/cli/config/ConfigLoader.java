package org.sportsmcp.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Resolves the application configuration for every CLI command.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dsports-mcp.http.port=9000})</li>
 *   <li>Environment variables</li>
 *   <li>The selected configuration file, if any</li>
 *   <li>{@code reference.conf} from the classpath</li>
 * </ol>
 * {@code reference.conf} is loaded unresolved and the merged stack is resolved once, so a
 * value overridden in the file also changes every substitution that refers to it, and the
 * optional {@code ${?SPORTS_MCP_...}} environment substitutions see the real environment.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "sports-mcp.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   message severity
         * @param message human-readable description
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the configuration file and loads the merged configuration.
     * <p>
     * The first existing candidate wins:
     * <ol>
     *   <li>the file passed with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/sports-mcp.conf} in the working directory</li>
     *   <li>{@code config/sports-mcp.conf} in the installation directory (parent of the {@code lib/} holding the jar)</li>
     * </ol>
     * Without any of them only the classpath defaults are used.
     *
     * @param explicitConfigFile file given on the command line, or {@code null}
     * @param handler            receives progress messages
     * @return the resolved configuration
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath() + " (--config)");
            return loadFromFile(explicitConfigFile);
        }

        final String propertyPath = System.getProperty("config.file");
        if (propertyPath != null && !propertyPath.isBlank()) {
            final File propertyFile = new File(propertyPath).getAbsoluteFile();
            if (!propertyFile.exists()) {
                throw new IllegalArgumentException("Configuration file named by -Dconfig.file not found: " + propertyFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + propertyFile + " (-Dconfig.file)");
            return loadFromFile(propertyFile);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installationFile = findInstallationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file " + installationFile.getAbsolutePath() + " (installation)");
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found; running with built-in defaults and SPORTS_MCP_* environment variables");
        return loadDefaults();
    }

    /**
     * @param configFile HOCON file layered over the classpath defaults
     * @return the resolved configuration
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * @return the classpath defaults with system properties and environment applied
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Expects the layout {@code APP_HOME/lib/sports-mcp-server.jar} next to
     * {@code APP_HOME/config/sports-mcp.conf}.
     *
     * @return the installation config file, or {@code null} if not found
     */
    private static File findInstallationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final File jarOrClasses;
        try {
            final URL location = codeSource.getLocation();
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jarOrClasses.isFile()) {
            // classes directory during development; the working directory lookup covers that case
            return null;
        }
        final File libDir = jarOrClasses.getParentFile();
        final File appHome = libDir != null ? libDir.getParentFile() : null;
        if (appHome == null) {
            return null;
        }
        final File candidate = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.exists() ? candidate : null;
    }
}
