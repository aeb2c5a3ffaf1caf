package com.polyast.cli;

import com.polyast.PolyastCLI;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void list_printsEveryLanguage() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = PolyastCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("list");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Java (JavaParser) (ID: java)")
            .contains("JavaScript (Rhino) (ID: javascript)")
            .contains("(ID: python)")
            .contains("Extensions: .py, .pyi")
            .contains("Parser: no (external front end)");
    }
}
