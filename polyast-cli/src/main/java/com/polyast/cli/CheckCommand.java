package com.polyast.cli;

import com.polyast.core.config.ConfigLoader;
import com.polyast.core.config.PolyastConfig;
import com.polyast.core.pipeline.NormalizationPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Command to normalize every supported file under a directory.
 *
 * <p>Files are normalized concurrently, one task per file, each bounded by the
 * configured wall-clock timeout. A failing or timed-out file is reported and the run
 * continues; the exit code is non-zero when any file failed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Check the current directory
 * polyast check
 *
 * # Check with a 5 second limit per file on 8 threads
 * polyast check src/ --timeout 5 --threads 8
 * }</pre>
 */
@Command(
    name = "check",
    description = "Normalize every supported file under a directory and report failures",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Directory to check (default: current directory)",
        defaultValue = "."
    )
    private Path root;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: polyast.yaml)")
    private Path configPath;

    @Option(names = {"--timeout"}, description = "Per-file timeout in seconds (overrides config)")
    private Integer timeoutSeconds;

    @Option(names = {"--threads"}, description = "Worker threads (overrides config)")
    private Integer threads;

    /**
     * Outcome of one file.
     *
     * @param path checked file
     * @param statements number of top-level statements, or -1 on failure
     * @param error failure message, null on success
     */
    record FileResult(Path path, int statements, String error) {
        boolean failed() {
            return error != null;
        }
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            PolyastConfig config = ConfigLoader.loadOrDefaults(configPath);
            NormalizationPipeline pipeline = new NormalizationPipeline(config);

            List<Path> files = findFiles(pipeline);
            out.println("Checking " + files.size() + " files under " + root.toAbsolutePath());

            int timeout = timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : config.driver().timeoutSeconds();
            int workers = threads != null && threads > 0 ? threads : config.driver().threads();
            List<FileResult> results = checkAll(pipeline, files, timeout, workers);

            long failed = results.stream().filter(FileResult::failed).count();
            for (FileResult result : results) {
                if (result.failed()) {
                    err.println("✗ " + result.path() + ": " + result.error());
                } else {
                    log.debug("{}: {} top-level statements", result.path(), result.statements());
                }
            }

            out.println();
            out.printf("%d files checked, %d ok, %d failed%n", results.size(), results.size() - failed, failed);
            out.flush();
            err.flush();
            return failed == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Check of {} failed", root, e);
            err.println("✗ Check failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private List<Path> findFiles(NormalizationPipeline pipeline) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(pipeline::supports)
                .sorted()
                .toList();
        }
    }

    private List<FileResult> checkAll(NormalizationPipeline pipeline, List<Path> files, int timeout, int workers) {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            Map<Path, Future<Integer>> futures = new LinkedHashMap<>();
            for (Path file : files) {
                futures.put(file, executor.submit(() -> pipeline.normalizeFile(file).size()));
            }

            // Timeouts are measured from the moment each result is awaited.
            List<FileResult> results = new ArrayList<>();
            for (Map.Entry<Path, Future<Integer>> entry : futures.entrySet()) {
                results.add(await(entry.getKey(), entry.getValue(), timeout));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileResult await(Path file, Future<Integer> future, int timeout) {
        try {
            return new FileResult(file, future.get(timeout, TimeUnit.SECONDS), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Timed out after {}s: {}", timeout, file);
            return new FileResult(file, -1, "timed out after " + timeout + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Failed to normalize {}", file, cause);
            return new FileResult(file, -1, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new FileResult(file, -1, "interrupted");
        }
    }
}
