package com.arxmlviewer.cli;

import com.arxmlviewer.core.xml.XmlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to run the cheap pre-parse checks on one or more files.
 *
 * <p>A file fails when it is not well-formed XML, or with {@code --strict}
 * when it does not look like an AUTOSAR document.
 */
@Command(
    name = "validate",
    description = "Check files for well-formed XML and AUTOSAR format",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "Files to validate")
    private List<Path> files;

    @Option(names = {"--strict"}, description = "Treat non-AUTOSAR XML as a failure")
    private boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int failures = 0;

        for (Path file : files) {
            log.debug("Validating: {}", file);
            if (!XmlValidator.isValidXml(file)) {
                out.println("✗ " + file + ": not well-formed XML");
                failures++;
                continue;
            }

            boolean autosar = XmlValidator.isAutosarXml(file);
            if (autosar) {
                out.println("✓ " + file + ": well-formed AUTOSAR XML");
            } else if (strict) {
                out.println("✗ " + file + ": well-formed XML but not an AUTOSAR document");
                failures++;
            } else {
                out.println("⚠ " + file + ": well-formed XML but not an AUTOSAR document");
            }
        }

        out.println();
        if (failures > 0) {
            out.println("✗ " + failures + " of " + files.size() + " files failed validation");
            return 1;
        }
        out.println("✓ All " + files.size() + " files passed validation");
        return 0;
    }
}
