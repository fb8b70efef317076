package com.arxmlviewer.cli;

import com.arxmlviewer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list ARXML files below a directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * arxml-viewer list
 * arxml-viewer list /path/to/project
 * }</pre>
 */
@Command(
    name = "list",
    description = "List ARXML files below a directory",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Directory to search (default: current directory)",
        defaultValue = "."
    )
    private Path directory;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isDirectory(directory)) {
            err.println("✗ Not a directory: " + directory);
            return 1;
        }

        List<Path> files;
        try {
            files = FileUtils.findArxmlFiles(directory);
        } catch (IOException e) {
            log.error("Failed to list {}", directory, e);
            err.println("✗ Failed to list " + directory + ": " + e.getMessage());
            return 1;
        }

        if (files.isEmpty()) {
            out.println("No ARXML files found in " + directory);
            return 0;
        }

        out.println("ARXML files in " + directory + ":");
        out.println();
        for (Path file : files) {
            out.printf("  %-60s %10s%n", directory.relativize(file), size(file));
        }
        out.println();
        out.println("Total: " + files.size() + " files");
        return 0;
    }

    private static String size(Path file) {
        try {
            return FileUtils.formatSize(Files.size(file));
        } catch (IOException e) {
            log.debug("Cannot read size of {}: {}", file, e.getMessage());
            return "?";
        }
    }
}
