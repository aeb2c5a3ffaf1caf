package com.polyast;

import com.polyast.cli.CheckCommand;
import com.polyast.cli.DumpCommand;
import com.polyast.cli.ListCommand;
import com.polyast.cli.TokensCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for PolyAST.
 *
 * <p>PolyAST parses Java, JavaScript and Python sources and translates them into one
 * language-agnostic syntax tree.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code dump} - Print the generic AST of a file as JSON</li>
 *   <li>{@code tokens} - Print the tokens of a file in source order</li>
 *   <li>{@code check} - Normalize every supported file under a directory</li>
 *   <li>{@code list} - List supported languages</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Dump a file without positions
 * polyast dump --abstract src/Main.java
 *
 * # Check a source tree with debug logging
 * polyast -v check src/
 * }</pre>
 */
@Command(
    name = "polyast",
    mixinStandardHelpOptions = true,
    version = "PolyAST 1.0.0-SNAPSHOT",
    description = "Generic AST normalizer for Java, JavaScript and Python",
    subcommands = {
        DumpCommand.class,
        TokensCommand.class,
        CheckCommand.class,
        ListCommand.class
    }
)
public class PolyastCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PolyastCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("PolyAST - Generic AST Normalizer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'polyast --help' to see available commands");
        System.out.println("Use 'polyast <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options. Runs before any subcommand.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured from the global options before
     * the selected subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PolyastCLI cli = new PolyastCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
