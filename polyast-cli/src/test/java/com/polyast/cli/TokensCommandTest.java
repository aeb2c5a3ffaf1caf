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
 * Tests for {@link TokensCommand}.
 */
class TokensCommandTest {

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

    @Test
    void tokens_javaScriptFile_printsPositionsInSourceOrder() throws IOException {
        Path file = tempDir.resolve("app.js");
        Files.writeString(file, "var x = 1;\nvar y = x;\n");

        int exitCode = run("tokens", file.toString());

        assertThat(exitCode).isZero();
        String output = out.toString();
        assertThat(output).contains("1:5 x", "2:5 y", "2:9 x");
        assertThat(output.indexOf("1:5 x")).isLessThan(output.indexOf("2:5 y"));
    }

    @Test
    void tokens_noFake_skipsSynthesizedTokens() throws IOException {
        Path file = tempDir.resolve("Main.java");
        Files.writeString(file, """
            class Main {
                int[] values = new int[3];
            }
            """);

        int exitCode = run("tokens", "--no-fake", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("1:7 Main").doesNotContain("(fake)");
    }

    @Test
    void tokens_unknownExtension_reportsFailure() throws IOException {
        Path file = tempDir.resolve("notes.txt");
        Files.writeString(file, "hello");

        int exitCode = run("tokens", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Token extraction failed", "notes.txt");
    }
}
