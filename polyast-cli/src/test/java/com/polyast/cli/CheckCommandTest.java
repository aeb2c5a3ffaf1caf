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
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest {

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

    private void writeValidSources() throws IOException {
        Files.createDirectories(tempDir.resolve("src/web"));
        Files.writeString(tempDir.resolve("src/A.java"), "class A { int f() { return 1; } }\n");
        Files.writeString(tempDir.resolve("src/web/b.js"), "function b(x) { return x * 2; }\n");
        Files.writeString(tempDir.resolve("README.md"), "# docs\n");
        Files.writeString(tempDir.resolve("src/tool.py"), "x = 1\n");
    }

    @Test
    void check_validTree_succeeds() throws IOException {
        writeValidSources();

        int exitCode = run("check", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Checking 2 files")
            .contains("2 files checked, 2 ok, 0 failed");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void check_brokenFile_isReportedAndRunContinues() throws IOException {
        writeValidSources();
        Files.writeString(tempDir.resolve("src/Broken.java"), "class Broken {\n");

        int exitCode = run("check", tempDir.toString(), "--threads", "2", "--timeout", "10");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("3 files checked, 2 ok, 1 failed");
        assertThat(err.toString()).contains("✗ ").contains("Broken.java");
    }

    @Test
    void check_disabledLanguage_skipsItsFiles() throws IOException {
        writeValidSources();
        Path config = tempDir.resolve("polyast.yaml");
        Files.writeString(config, """
            languages:
              enabled: [javascript]
            """);

        int exitCode = run("check", tempDir.toString(), "--config", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("1 files checked, 1 ok, 0 failed");
    }

    @Test
    void check_missingDirectory_reportsFailure() {
        int exitCode = run("check", tempDir.resolve("nowhere").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Check failed");
    }
}
