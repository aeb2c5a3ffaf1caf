package com.polyast.cli;

import com.polyast.PolyastCLI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DumpCommand}.
 */
class DumpCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = PolyastCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path writeJava() throws IOException {
        Path file = tempDir.resolve("Hello.java");
        Files.writeString(file, """
            public class Hello {
                void greet() {
                    System.out.println("hi");
                }
            }
            """);
        return file;
    }

    @Test
    void dump_javaFile_printsJsonWithPositions() throws IOException {
        int exitCode = run("dump", writeJava().toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("\"node\" : \"Any.AProgram\"")
            .contains("Stmt.DefStmt")
            .contains("\"line\"");
    }

    @Test
    void dump_abstract_erasesPositions() throws IOException {
        int exitCode = run("dump", "--abstract", writeJava().toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("\"abstract\" : true")
            .doesNotContain("\"line\"");
    }

    @Test
    void dump_noTokens_omitsTokenObjects() throws IOException {
        int exitCode = run("dump", "--no-tokens", writeJava().toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Stmt.DefStmt")
            .doesNotContain("\"line\"")
            .doesNotContain("\"abstract\"");
    }

    @Test
    void dump_configFile_appliesDumpSettings() throws IOException {
        Path config = tempDir.resolve("polyast.yaml");
        Files.writeString(config, """
            dump:
              abstractPositions: true
              pretty: false
            """);

        int exitCode = run("dump", "--config", config.toString(), writeJava().toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).doesNotContain("\n").doesNotContain("\"line\"");
    }

    @Test
    void dump_missingFile_reportsFailure() {
        int exitCode = run("dump", tempDir.resolve("Missing.java").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Dump failed");
    }

    @Test
    void dump_pythonFile_reportsMissingParser() throws IOException {
        Path file = tempDir.resolve("tool.py");
        Files.writeString(file, "x = 1\n");

        int exitCode = run("dump", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("No parser available for python");
    }
}
