package com.polyast.cli;

import com.polyast.core.lang.Language;
import com.polyast.core.normalizer.NormalizerProvider;
import com.polyast.core.normalizer.Normalizers;
import com.polyast.core.parser.SourceParserFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to list the supported languages.
 *
 * <p>Normalizers are discovered via Java Service Provider Interface (SPI); parser
 * availability comes from {@link SourceParserFactory}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * polyast list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported languages, their normalizers and parsers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Supported Languages:");
        out.println();

        for (Language language : Language.values()) {
            Optional<NormalizerProvider> provider = Normalizers.provider(language);
            boolean parser = SourceParserFactory.isAvailable(language);
            out.printf("  • %s (ID: %s)%n", provider.map(NormalizerProvider::getDisplayName).orElse(language.id()),
                language.id());
            out.printf("    Extensions: %s%n", String.join(", ", language.extensions()));
            out.printf("    Normalizer: %s%n", provider.isPresent() ? "yes" : "no");
            out.printf("    Parser: %s%n", parser ? "yes" : "no (external front end)");
            out.println();
        }
        out.flush();

        log.debug("Listed {} languages", Language.values().length);
        return 0;
    }
}
