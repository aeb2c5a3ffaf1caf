package com.polyast;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PolyastCLI}.
 */
class PolyastCLITest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = PolyastCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void version_printsVersion() {
        int exitCode = run("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("PolyAST 1.0.0-SNAPSHOT");
    }

    @Test
    void help_listsSubcommands() {
        int exitCode = run("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("dump", "tokens", "check", "list");
    }

    @Test
    void unknownOption_returnsUsageError() {
        int exitCode = run("--no-such-option");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--no-such-option");
    }

    @Test
    void globalOptions_areParsedBeforeSubcommand() {
        PolyastCLI cli = new PolyastCLI();
        new CommandLine(cli).parseArgs("-v", "list");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }
}
