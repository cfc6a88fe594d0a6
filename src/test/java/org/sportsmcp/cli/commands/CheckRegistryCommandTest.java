package org.sportsmcp.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sportsmcp.cli.CommandLineInterface;
import org.sportsmcp.test.utils.PitchingOutingsFixture;

import picocli.CommandLine;

@Tag("unit")
class CheckRegistryCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void validRegistryListsDatasets() throws Exception {
        Path registry = PitchingOutingsFixture.writeRegistry(tempDir.resolve("registry"));

        int exitCode = commandLine.execute("check-registry", "--directory", registry.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("pitching_outings")
            .contains("marts_baseball.pitching_outings (6 columns, key: player_id, game_date)")
            .contains("1 dataset(s) OK in");
    }

    @Test
    void invalidDescriptorFails() throws Exception {
        Path registry = Files.createDirectories(tempDir.resolve("broken"));
        Files.writeString(registry.resolve("bad.json"), "{\"dataset_id\": \"x\"}");

        int exitCode = commandLine.execute("check-registry", "-d", registry.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Registry invalid: ").contains("schema");
    }

    @Test
    void configuredDirectoryIsUsedWithoutOption() throws Exception {
        Path registry = PitchingOutingsFixture.writeRegistry(tempDir.resolve("registry"));
        Path config = tempDir.resolve("test.conf");
        Files.writeString(config, "sports-mcp.registry.directory = \"" + registry + "\"\n"
            + "logging.format = PLAIN\nlogging.default-level = WARN\n");

        int exitCode = commandLine.execute("--config", config.toString(), "check-registry");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("1 dataset(s) OK in " + registry.toAbsolutePath());
    }

    @Test
    void missingConfigFileIsAParameterError() {
        int exitCode = commandLine.execute("--config", tempDir.resolve("absent.conf").toString(), "check-registry");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
