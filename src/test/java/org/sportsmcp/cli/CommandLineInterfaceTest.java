package org.sportsmcp.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import picocli.CommandLine;

@Tag("unit")
class CommandLineInterfaceTest {

    @Test
    void withoutSubcommandPrintsUsage() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("sports-mcp")
            .contains("serve")
            .contains("check-registry")
            .contains("generate-registry")
            .contains("SPORTS_MCP_JDBC_URL");
    }

    @Test
    void unknownSubcommandIsRejected() {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute("frobnicate")).isEqualTo(2);
    }
}
