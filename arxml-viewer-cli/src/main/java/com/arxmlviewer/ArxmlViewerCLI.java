package com.arxmlviewer;

import ch.qos.logback.classic.Level;
import com.arxmlviewer.cli.InfoCommand;
import com.arxmlviewer.cli.ListCommand;
import com.arxmlviewer.cli.ParseCommand;
import com.arxmlviewer.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for the ARXML viewer.
 *
 * <p>Reads AUTOSAR ARXML files and prints their package, component and port
 * hierarchy, composition connectors and file diagnostics.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code parse} - Parse a file and print the package tree or JSON</li>
 *   <li>{@code validate} - Check files for well-formedness and AUTOSAR format</li>
 *   <li>{@code info} - Print XML diagnostics for a file</li>
 *   <li>{@code list} - List ARXML files below a directory</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Print the component tree with connectors
 * arxml-viewer parse system.arxml --connections
 *
 * # Machine-readable output
 * arxml-viewer parse system.arxml --format json
 *
 * # Validate every file of a project
 * arxml-viewer validate ecu/*.arxml
 * }</pre>
 */
@Command(
    name = "arxml-viewer",
    mixinStandardHelpOptions = true,
    version = "ARXML Viewer 1.0.0-SNAPSHOT",
    description = "Browse AUTOSAR ARXML packages, components, ports and connectors",
    subcommands = {
        ParseCommand.class,
        ValidateCommand.class,
        InfoCommand.class,
        ListCommand.class
    }
)
public class ArxmlViewerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ArxmlViewerCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("ARXML Viewer - AUTOSAR package and component browser");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'arxml-viewer --help' to see available commands");
        out.println("Use 'arxml-viewer <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options, then runs the most specific command given.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        if (!(LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root)) {
            log.debug("Logging backend is not Logback; -v/-q have no effect");
            return;
        }

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global option handling installed.
     *
     * @return configured command line
     */
    public static CommandLine newCommandLine() {
        ArxmlViewerCLI cli = new ArxmlViewerCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
