package com.polyast.cli;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.visitor.AstTraversals;
import com.polyast.core.config.ConfigLoader;
import com.polyast.core.config.PolyastConfig;
import com.polyast.core.dump.GastJsonDumper;
import com.polyast.core.pipeline.NormalizationPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print the generic AST of one file as JSON.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Full dump with token positions
 * polyast dump src/Main.java
 *
 * # Position-free dump, e.g. to diff two versions of a file
 * polyast dump --abstract src/Main.java
 * }</pre>
 */
@Command(
    name = "dump",
    description = "Normalize a file and print its generic AST as JSON",
    mixinStandardHelpOptions = true
)
public class DumpCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DumpCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file to normalize")
    private Path file;

    @Option(names = {"--abstract"}, description = "Erase token positions before printing")
    private Boolean abstractPositions;

    @Option(names = {"--no-tokens"}, description = "Omit tokens from the output")
    private boolean noTokens;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: polyast.yaml)")
    private Path configPath;

    @Override
    public Integer call() {
        try {
            PolyastConfig config = ConfigLoader.loadOrDefaults(configPath);
            List<Stmt> program = new NormalizationPipeline(config).normalizeFile(file);

            Any tree = Any.program(program);
            boolean erase = abstractPositions != null ? abstractPositions : config.dump().abstractPositions();
            if (erase) {
                tree = AstTraversals.abstractPositionInfo(tree);
            }

            boolean includeTokens = !noTokens && config.dump().includeTokens();
            GastJsonDumper dumper = new GastJsonDumper(includeTokens, config.dump().pretty());
            spec.commandLine().getOut().println(dumper.toJson(tree));
            spec.commandLine().getOut().flush();
            return 0;

        } catch (Exception e) {
            log.error("Dump of {} failed", file, e);
            spec.commandLine().getErr().println("✗ Dump failed: " + e.getMessage());
            return 1;
        }
    }
}
