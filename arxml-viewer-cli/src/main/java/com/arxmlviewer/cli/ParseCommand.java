package com.arxmlviewer.cli;

import com.arxmlviewer.core.config.ConfigLoader;
import com.arxmlviewer.core.config.ViewerConfig;
import com.arxmlviewer.core.model.ArPackage;
import com.arxmlviewer.core.model.Component;
import com.arxmlviewer.core.model.Connection;
import com.arxmlviewer.core.model.ConnectionEndpoint;
import com.arxmlviewer.core.model.DataElement;
import com.arxmlviewer.core.model.Operation;
import com.arxmlviewer.core.model.Port;
import com.arxmlviewer.core.model.PortInterface;
import com.arxmlviewer.core.parser.ArxmlParseException;
import com.arxmlviewer.core.parser.ArxmlParser;
import com.arxmlviewer.core.parser.DebugInfo;
import com.arxmlviewer.core.parser.ParseResult;
import com.arxmlviewer.core.parser.ParseStatistics;
import com.arxmlviewer.core.util.FileUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to parse an ARXML file and print its package tree.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Tree with ports
 * arxml-viewer parse system.arxml
 *
 * # Tree with composition connectors
 * arxml-viewer parse system.arxml --connections
 *
 * # JSON for other tools
 * arxml-viewer parse system.arxml --format json
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Parse an ARXML file and print packages, components and ports",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "ARXML file to parse")
    private Path file;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-f", "--format"},
        description = "Output format: text or json (overrides config)"
    )
    private String format;

    @Option(
        names = {"--connections"},
        description = "Also print composition connectors"
    )
    private boolean showConnections;

    @Option(
        names = {"--no-ports"},
        description = "Do not print ports"
    )
    private boolean hidePorts;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ViewerConfig config = loadConfiguration();
        String sizeProblem = checkSize(config);
        if (sizeProblem != null) {
            log.error("Parse refused: {}", sizeProblem);
            err.println("✗ Failed to parse " + file + ": " + sizeProblem);
            return 1;
        }
        ArxmlParser parser = new ArxmlParser(config.parser());

        ParseResult result;
        try {
            result = parser.parseFile(file);
        } catch (ArxmlParseException e) {
            log.error("Parse failed: {}", e.getMessage());
            err.println("✗ Failed to parse " + file + ": " + e.getMessage());
            return 1;
        }

        boolean json = format != null ? "json".equalsIgnoreCase(format) : config.output().isJson();
        if (json) {
            return printJson(out, err, result, parser);
        }

        if (result.isEmpty()) {
            out.println("No packages found in " + file);
            return 0;
        }

        Map<String, String> names = componentNames(result);
        boolean ports = !hidePorts && config.output().showPorts();
        for (ArPackage pkg : result.packages()) {
            printPackage(out, pkg, 0, ports);
        }

        if (showConnections || config.output().showConnections()) {
            printConnections(out, parser.getParsedConnections(), names);
        }

        printSummary(out, result);
        return 0;
    }

    private ViewerConfig loadConfiguration() {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("No configuration file at {}, using defaults", configPath);
            return ViewerConfig.defaults();
        }
        return ConfigLoader.load(configPath);
    }

    /**
     * Applies the configured file size limit before the document is loaded.
     *
     * @return problem description, or null if the file may be parsed
     */
    private String checkSize(ViewerConfig config) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            long size = Files.size(file);
            if (size > config.parser().maxFileSizeBytes()) {
                return String.format("file is %s, larger than the configured limit of %d MB",
                    FileUtils.formatSize(size), config.parser().maxFileSizeMb());
            }
        } catch (IOException e) {
            log.debug("Cannot read size of {}: {}", file, e.getMessage());
        }
        return null;
    }

    private int printJson(PrintWriter out, PrintWriter err, ParseResult result, ArxmlParser parser) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("packages", result.packages());
        document.put("connections", parser.getParsedConnections());
        document.put("interfaces", parser.getParsedInterfaces());
        document.put("metadata", result.metadata());
        try {
            out.println(JsonOutput.write(document));
            return 0;
        } catch (JsonProcessingException e) {
            log.error("JSON serialization failed", e);
            err.println("✗ Failed to write JSON: " + e.getMessage());
            return 1;
        }
    }

    private void printPackage(PrintWriter out, ArPackage pkg, int level, boolean ports) {
        String indent = "  ".repeat(level);
        out.println(indent + "[PKG] " + displayName(pkg.shortName()) + " (" + pkg.fullPath() + ")");

        for (PortInterface portInterface : pkg.interfaces()) {
            out.println(indent + "  [IF] " + displayName(portInterface.shortName())
                + " <" + portInterface.interfaceType() + ">");
            for (DataElement dataElement : portInterface.dataElements()) {
                out.println(indent + "    - " + dataElement.name() + " : " + dataElement.typeName());
            }
            for (Operation operation : portInterface.operations()) {
                out.println(indent + "    - " + operation.name() + "(" + operation.arguments().stream()
                    .map(argument -> argument.direction() + " " + argument.name() + " : " + argument.typeName())
                    .collect(Collectors.joining(", ")) + ")");
            }
        }

        for (Component component : pkg.components()) {
            out.println(indent + "  [" + component.componentType() + "] " + displayName(component.shortName()));
            if (ports) {
                for (Port port : component.ports()) {
                    out.println(indent + "    " + (port.isProvided() ? "P " : "R ") + displayName(port.shortName()));
                }
            }
            if (component.isComposition()) {
                component.prototypes().forEach(prototype -> out.println(indent + "    * "
                    + prototype.shortName() + " : " + prototype.typeRef()
                    + (prototype.isResolved() ? "" : " (unresolved)")));
            }
        }

        for (ArPackage subPackage : pkg.subPackages()) {
            printPackage(out, subPackage, level + 1, ports);
        }
    }

    private void printConnections(PrintWriter out, List<Connection> connections, Map<String, String> names) {
        out.println();
        out.println("Connections (" + connections.size() + "):");
        for (Connection connection : connections) {
            out.println("  " + connection.connectionType() + " " + displayName(connection.shortName()) + ": "
                + endpoint(connection.provider(), names) + " -> " + endpoint(connection.requester(), names)
                + (connection.isResolved() ? "" : "  [unresolved]"));
        }
    }

    private static String endpoint(ConnectionEndpoint endpoint, Map<String, String> names) {
        String owner = endpoint.componentUuid() != null
            ? names.getOrDefault(endpoint.componentUuid(), "?")
            : (endpoint.prototypeName().isEmpty() ? "?" : endpoint.prototypeName() + "?");
        return owner + "." + (endpoint.portName().isEmpty() ? "?" : endpoint.portName());
    }

    private void printSummary(PrintWriter out, ParseResult result) {
        ParseStatistics statistics = result.metadata().statistics();
        DebugInfo debug = result.metadata().debugInfo();
        out.println();
        out.println("✓ " + statistics.getSummary());
        out.println("  File size: " + FileUtils.formatSize(result.metadata().fileSize())
            + ", AUTOSAR version: " + result.metadata().autosarVersion());
        if (debug.prototypesAttempted() > debug.prototypesSuccessful() || debug.unresolvedEndpoints() > 0) {
            out.println("  Unresolved: " + (debug.prototypesAttempted() - debug.prototypesSuccessful())
                + " prototype references, " + debug.unresolvedEndpoints() + " connector endpoints");
        }
        if (debug.totalSkipped() > 0) {
            out.println("  Skipped elements: " + debug.totalSkipped());
        }
    }

    private static Map<String, String> componentNames(ParseResult result) {
        Map<String, String> names = new HashMap<>();
        for (Component component : result.allComponents()) {
            names.put(component.uuid(), component.shortName());
        }
        return names;
    }

    private static String displayName(String name) {
        return name.isEmpty() ? "<unnamed>" : name;
    }
}
