package com.arxmlviewer.core.parser;

import com.arxmlviewer.core.config.ParserOptions;
import com.arxmlviewer.core.model.ArPackage;
import com.arxmlviewer.core.model.ArgumentDirection;
import com.arxmlviewer.core.model.Component;
import com.arxmlviewer.core.model.ComponentPrototype;
import com.arxmlviewer.core.model.ComponentType;
import com.arxmlviewer.core.model.Connection;
import com.arxmlviewer.core.model.DataElement;
import com.arxmlviewer.core.model.InterfaceType;
import com.arxmlviewer.core.model.Operation;
import com.arxmlviewer.core.model.OperationArgument;
import com.arxmlviewer.core.model.PortDirection;
import com.arxmlviewer.core.model.PortInterface;
import com.arxmlviewer.core.xml.ElementQuery;
import com.arxmlviewer.core.xml.NamespaceResolver;
import com.arxmlviewer.core.xml.XmlDocuments;
import com.arxmlviewer.core.xml.XmlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses AUTOSAR ARXML files into a forest of {@link ArPackage} trees.
 *
 * <p>Parsing runs in two passes. The first walks {@code AR-PACKAGE} elements
 * depth-first and builds packages, components, ports and interfaces. The
 * second binds composition prototypes to their component types, turns
 * connectors into {@link Connection}s and binds port interface references.
 *
 * <p>Only unreadable files and malformed XML fail a parse. Unknown tags,
 * missing short names and dangling references are absorbed and reported
 * through {@link ParseMetadata#debugInfo()}.
 *
 * <p>An instance keeps the connections and interfaces of its last call, so it
 * must not be used from two threads at once.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArxmlParser parser = new ArxmlParser(ParserOptions.defaults());
 * ParseResult result = parser.parseFile(Path.of("system.arxml"));
 * List<Connection> connections = parser.getParsedConnections();
 * }</pre>
 */
public class ArxmlParser {

    private static final Logger log = LoggerFactory.getLogger(ArxmlParser.class);

    private static final String XSI_NAMESPACE = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;
    private static final Pattern DOTTED_VERSION = Pattern.compile("AUTOSAR_(\\d+)-(\\d+)-(\\d+)");
    private static final Pattern REVISION_VERSION = Pattern.compile("AUTOSAR_(\\d{5})");

    private final ParserOptions options;
    private final List<Connection> connections = new ArrayList<>();
    private final List<PortInterface> interfaces = new ArrayList<>();
    private ParseMetadata lastMetadata;

    public ArxmlParser() {
        this(ParserOptions.defaults());
    }

    public ArxmlParser(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Parses an ARXML file.
     *
     * @param file path to the ARXML document
     * @return package forest and metadata
     * @throws ArxmlParseException if the file cannot be read or is not well-formed
     */
    public ParseResult parseFile(Path file) throws ArxmlParseException {
        connections.clear();
        interfaces.clear();
        lastMetadata = null;

        long start = System.nanoTime();
        long fileSize = checkFile(file);
        log.info("Starting ARXML parsing: {} ({} bytes)", file, fileSize);

        Document document = load(file);
        Element root = document.getDocumentElement();
        NamespaceResolver namespaces = NamespaceResolver.fromRoot(root);
        boolean autosar = XmlValidator.isAutosarDocument(document);
        if (options.validateXml() && !autosar) {
            log.warn("File does not look like an AUTOSAR document (root element: {}): {}",
                XmlDocuments.localName(root), file);
        }

        Walk walk = new Walk(new ElementQuery(namespaces));
        List<ArPackage.Builder> roots = walk.packages(root);

        if (options.resolveReferences()) {
            CompositionResolver resolver = new CompositionResolver(walk.query, walk.index, walk.debug);
            connections.addAll(resolver.resolveCompositions(walk.compositions));
            if (options.parseInterfaces()) {
                resolver.resolveInterfaceReferences();
            }
        }

        List<ArPackage> packages = roots.stream().map(ArPackage.Builder::build).toList();
        double parseTime = (System.nanoTime() - start) / 1_000_000_000.0;
        ParseStatistics statistics = walk.statistics
            .connectionsParsed(connections.size())
            .build(parseTime);

        lastMetadata = new ParseMetadata(
            file.toString(),
            fileSize,
            parseTime,
            statistics,
            walk.debug.build(),
            namespaces.namespaces(),
            detectAutosarVersion(root.getAttributeNS(XSI_NAMESPACE, "schemaLocation")),
            autosar
        );

        log.info("ARXML parsing completed in {}s", String.format("%.3f", parseTime));
        log.info("Parsed: {}", statistics.getSummary());
        return new ParseResult(packages, lastMetadata);
    }

    /**
     * Returns the connectors recorded by the last successful call.
     *
     * @return connections in document order, empty before the first parse or after a failure
     */
    public List<Connection> getParsedConnections() {
        return List.copyOf(connections);
    }

    /**
     * Returns every port interface parsed by the last successful call.
     *
     * @return interfaces in document order
     */
    public List<PortInterface> getParsedInterfaces() {
        return List.copyOf(interfaces);
    }

    /**
     * Returns metadata of the last successful call.
     *
     * @return metadata, or null if the last call failed or none was made
     */
    public ParseMetadata getLastMetadata() {
        return lastMetadata;
    }

    /**
     * Extracts an AUTOSAR release from a schema location value.
     *
     * @param schemaLocation value of {@code xsi:schemaLocation}, may be null
     * @return e.g. {@code 4.3.0} or {@code 00046}, otherwise {@link ParseMetadata#UNKNOWN_VERSION}
     */
    static String detectAutosarVersion(String schemaLocation) {
        if (schemaLocation == null || schemaLocation.isBlank()) {
            return ParseMetadata.UNKNOWN_VERSION;
        }
        Matcher dotted = DOTTED_VERSION.matcher(schemaLocation);
        if (dotted.find()) {
            return dotted.group(1) + "." + dotted.group(2) + "." + dotted.group(3);
        }
        Matcher revision = REVISION_VERSION.matcher(schemaLocation);
        if (revision.find()) {
            return revision.group(1);
        }
        return ParseMetadata.UNKNOWN_VERSION;
    }

    private long checkFile(Path file) throws ArxmlParseException {
        if (file == null || !Files.exists(file)) {
            throw new ArxmlParseException("File not found: " + file);
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new ArxmlParseException("File is not readable: " + file);
        }
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new ArxmlParseException("Cannot read file " + file + ": " + e.getMessage(), e);
        }
    }

    private static Document load(Path file) throws ArxmlParseException {
        try {
            return XmlDocuments.load(file);
        } catch (SAXException e) {
            throw new ArxmlParseException("XML syntax error in " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ArxmlParseException("Cannot read file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * State of the first pass over one document.
     */
    private final class Walk {
        private final ElementQuery query;
        private final ModelIndex index = new ModelIndex();
        private final ParseStatistics.Builder statistics = new ParseStatistics.Builder();
        private final DebugInfo.Builder debug = new DebugInfo.Builder();
        private final List<CompositionResolver.PendingComposition> compositions = new ArrayList<>();

        private Walk(ElementQuery query) {
            this.query = query;
        }

        List<ArPackage.Builder> packages(Element root) {
            List<ArPackage.Builder> result = new ArrayList<>();
            for (Element packageElement : query.findElements(root, "AR-PACKAGES/AR-PACKAGE")) {
                result.add(parsePackage(packageElement, ""));
            }
            return result;
        }

        private ArPackage.Builder parsePackage(Element element, String parentPath) {
            String shortName = query.getText(element, "SHORT-NAME");
            if (shortName.isEmpty()) {
                log.debug("AR-PACKAGE without SHORT-NAME below '{}'", parentPath);
            }
            ArPackage.Builder pkg = new ArPackage.Builder(shortName, parentPath, description(element));
            statistics.incrementPackages();

            query.findElement(element, "ELEMENTS")
                .ifPresent(elements -> parseElements(elements, pkg));

            for (Element child : query.findElements(element, "SUB-PACKAGES/AR-PACKAGE")) {
                pkg.addSubPackage(parsePackage(child, pkg.fullPath()));
            }
            return pkg;
        }

        private void parseElements(Element elements, ArPackage.Builder pkg) {
            for (Element child : query.childElements(elements)) {
                String tag = XmlDocuments.localName(child);
                ComponentType componentType = ComponentType.fromTag(tag);
                InterfaceType interfaceType = InterfaceType.fromTag(tag);

                if (componentType.isRecognized()) {
                    pkg.addComponent(parseComponent(child, componentType, pkg.fullPath()));
                } else if (interfaceType.isRecognized() && options.parseInterfaces()) {
                    pkg.addInterface(parseInterface(child, interfaceType, pkg.fullPath()));
                } else {
                    if (ComponentType.isComponentTag(tag)) {
                        log.debug("Skipping unrecognized component type {} in {}", tag, pkg.fullPath());
                    }
                    debug.recordSkipped(tag);
                }
            }
        }

        private Component.Builder parseComponent(Element element, ComponentType type, String packagePath) {
            Component.Builder component = new Component.Builder(
                query.getText(element, "SHORT-NAME"), type, description(element), packagePath);
            statistics.incrementComponents();
            index.registerComponent(component);

            query.findElement(element, "PORTS")
                .ifPresent(ports -> parsePorts(ports, component));

            if (type == ComponentType.COMPOSITION) {
                debug.incrementCompositionsFound();
                for (Element prototype : query.findElements(element, "COMPONENTS/SW-COMPONENT-PROTOTYPE")) {
                    component.addPrototype(new ComponentPrototype(
                        query.getText(prototype, "SHORT-NAME"),
                        query.getText(prototype, "TYPE-TREF"),
                        null));
                }
                compositions.add(new CompositionResolver.PendingComposition(component, element));
            } else {
                debug.incrementStandaloneComponents();
            }
            return component;
        }

        private void parsePorts(Element ports, Component.Builder component) {
            for (Element portElement : query.childElements(ports)) {
                String tag = XmlDocuments.localName(portElement);
                PortDirection direction = PortDirection.fromTag(tag);
                if (!direction.isRecognized()) {
                    debug.recordSkipped(tag);
                    log.debug("Skipping port tag {} on {}", tag, component.fullPath());
                    continue;
                }
                String interfaceRef = query.getText(portElement,
                    direction == PortDirection.PROVIDED ? "PROVIDED-INTERFACE-TREF" : "REQUIRED-INTERFACE-TREF",
                    null);
                component.addPort(query.getText(portElement, "SHORT-NAME"), direction,
                    description(portElement), interfaceRef);
                statistics.incrementPorts();
            }
        }

        private PortInterface parseInterface(Element element, InterfaceType type, String packagePath) {
            List<DataElement> dataElements = new ArrayList<>();
            List<Operation> operations = new ArrayList<>();
            switch (type) {
                case SENDER_RECEIVER -> dataElements.addAll(dataElements(element, "DATA-ELEMENTS/VARIABLE-DATA-PROTOTYPE"));
                case NV_DATA -> dataElements.addAll(dataElements(element, "NV-DATAS/VARIABLE-DATA-PROTOTYPE"));
                case MODE_SWITCH -> dataElements.addAll(
                    dataElements(element, "MODE-DECLARATION-GROUPS/MODE-DECLARATION-GROUP"));
                case CLIENT_SERVER -> operations.addAll(operations(element, "OPERATIONS/CLIENT-SERVER-OPERATION"));
                case TRIGGER -> operations.addAll(operations(element, "TRIGGERS/TRIGGER"));
                default -> log.debug("No content rules for interface type {}", type);
            }

            PortInterface portInterface = new PortInterface(
                UUID.randomUUID().toString(),
                query.getText(element, "SHORT-NAME"),
                type,
                description(element),
                packagePath,
                dataElements,
                operations
            );
            statistics.incrementInterfaces();
            index.registerInterface(portInterface);
            interfaces.add(portInterface);
            return portInterface;
        }

        private List<DataElement> dataElements(Element owner, String path) {
            List<DataElement> result = new ArrayList<>();
            for (Element element : query.findElements(owner, path)) {
                String name = query.getText(element, "SHORT-NAME");
                if (!name.isEmpty()) {
                    result.add(new DataElement(name, query.getText(element, "TYPE-TREF", null), description(element)));
                }
            }
            return result;
        }

        private List<Operation> operations(Element owner, String path) {
            List<Operation> result = new ArrayList<>();
            for (Element element : query.findElements(owner, path)) {
                String name = query.getText(element, "SHORT-NAME");
                if (name.isEmpty()) {
                    continue;
                }
                List<OperationArgument> arguments = new ArrayList<>();
                for (Element argument : query.findElements(element, "ARGUMENTS/ARGUMENT-DATA-PROTOTYPE")) {
                    String argumentName = query.getText(argument, "SHORT-NAME");
                    if (!argumentName.isEmpty()) {
                        arguments.add(new OperationArgument(
                            argumentName,
                            ArgumentDirection.fromText(query.getText(argument, "DIRECTION", null)),
                            query.getText(argument, "TYPE-TREF", null),
                            description(argument)));
                    }
                }
                result.add(new Operation(name, description(element), arguments));
            }
            return result;
        }

        private String description(Element element) {
            return query.getText(element, "DESC/L-2", null);
        }
    }
}
