package org.sportsmcp.cli.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("sports-mcp.http.port");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should layer the file over the classpath defaults")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(10, config.getInt("sports-mcp.database.maxPoolSize"));
    }

    @Test
    @DisplayName("File values should flow through substitutions into process options")
    void loadFromFile_fileOverridePropagatesToProcesses() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(9100, config.getInt("node.processes.http.options.port"));
        assertEquals("/srv/sports-mcp/registry",
            config.getString("node.processes.datasets.options.registry.directory"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("sports-mcp.http.port", "9200");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(9200, config.getInt("node.processes.http.options.port"));
    }

    @Test
    @DisplayName("loadDefaults should expose the built-in process layout")
    void loadDefaults_shouldReturnValidConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertTrue(config.hasPath("node.processes.datasets.className"));
        assertEquals("datasets", config.getString("node.processes.http.require.services"));
        assertEquals("COLOR", config.getString("logging.format"));
    }

    @Test
    @DisplayName("resolve should use an explicit file and report it")
    void resolve_usesExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
            (level, message) -> messages.add(level + " " + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file"));
        assertTrue(messages.get(0).endsWith("(--config)"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_rejectsMissingExplicitFile() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.resolve(new File("does-not-exist.conf"), (level, message) -> { }));

        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("Unresolvable substitutions should fail loading")
    void loadFromFile_unresolvableSubstitutionFails() {
        assertThrows(ConfigException.class, () -> ConfigLoader.loadFromFile(testResource("broken-config.conf")));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
