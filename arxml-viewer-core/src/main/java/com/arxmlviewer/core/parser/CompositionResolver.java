package com.arxmlviewer.core.parser;

import com.arxmlviewer.core.model.Component;
import com.arxmlviewer.core.model.ComponentPrototype;
import com.arxmlviewer.core.model.Connection;
import com.arxmlviewer.core.model.ConnectionEndpoint;
import com.arxmlviewer.core.model.ConnectionType;
import com.arxmlviewer.core.model.Port;
import com.arxmlviewer.core.model.PortInterface;
import com.arxmlviewer.core.xml.ElementQuery;
import com.arxmlviewer.core.xml.XmlDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Second parser pass: binds prototypes to component types, connectors to
 * ports and ports to their interfaces.
 *
 * <p>Runs only after every package has been walked, because connectors may
 * reference prototypes and types declared anywhere in the document. Nothing
 * here throws on bad references; dangling ones are kept with null identifiers
 * and counted in {@link DebugInfo}.
 */
class CompositionResolver {

    private static final Logger log = LoggerFactory.getLogger(CompositionResolver.class);

    private final ElementQuery query;
    private final ModelIndex index;
    private final DebugInfo.Builder debug;

    CompositionResolver(ElementQuery query, ModelIndex index, DebugInfo.Builder debug) {
        this.query = query;
        this.index = index;
        this.debug = debug;
    }

    /**
     * A composition collected in the first pass together with its source element.
     */
    record PendingComposition(Component.Builder component, Element element) {
    }

    /**
     * Resolves prototypes and connectors of all given compositions.
     *
     * @param compositions compositions in document order
     * @return connections in document order
     */
    List<Connection> resolveCompositions(List<PendingComposition> compositions) {
        List<Connection> connections = new ArrayList<>();
        for (PendingComposition pending : compositions) {
            resolvePrototypes(pending.component());
            connections.addAll(resolveConnectors(pending));
        }
        return connections;
    }

    /**
     * Binds every port interface reference that matches a parsed interface.
     */
    void resolveInterfaceReferences() {
        for (Component.Builder component : index.components()) {
            for (Port port : component.ports()) {
                String reference = port.interfaceRef();
                if (reference == null || reference.isBlank()) {
                    continue;
                }
                Optional<PortInterface> target = index.findInterface(reference);
                if (target.isPresent()) {
                    component.replacePort(port.withInterfaceUuid(target.get().uuid()));
                } else {
                    debug.incrementUnresolvedInterfaceRefs();
                    log.debug("Unresolved interface reference {} on port {}/{}",
                        reference, component.fullPath(), port.shortName());
                }
            }
        }
    }

    private void resolvePrototypes(Component.Builder composition) {
        List<ComponentPrototype> prototypes = composition.prototypes();
        for (int i = 0; i < prototypes.size(); i++) {
            ComponentPrototype prototype = prototypes.get(i);
            Optional<Component.Builder> type = index.findComponent(prototype.typeRef());
            debug.recordPrototypeAttempt(type.isPresent());
            if (type.isPresent()) {
                composition.replacePrototype(i,
                    new ComponentPrototype(prototype.shortName(), prototype.typeRef(), type.get().uuid()));
            } else {
                log.debug("Prototype {} in {} references unknown type {}",
                    prototype.shortName(), composition.fullPath(), prototype.typeRef());
            }
        }
    }

    private List<Connection> resolveConnectors(PendingComposition pending) {
        List<Connection> connections = new ArrayList<>();
        Optional<Element> connectors = query.findElement(pending.element(), "CONNECTORS");
        if (connectors.isEmpty()) {
            return connections;
        }

        for (Element connector : query.childElements(connectors.get())) {
            String tag = XmlDocuments.localName(connector);
            ConnectionType type = ConnectionType.fromTag(tag);
            if (!type.isRecognized()) {
                debug.recordSkipped(tag);
                log.debug("Skipping unrecognized connector {} in {}", tag, pending.component().fullPath());
                continue;
            }
            Connection connection = switch (type) {
                case ASSEMBLY -> assembly(pending.component(), connector);
                case DELEGATION -> delegation(pending.component(), connector);
                case PASS_THROUGH -> passThrough(pending.component(), connector);
                default -> throw new IllegalStateException("Unhandled connector type: " + type);
            };
            countUnresolved(connection);
            connections.add(connection);
        }
        return connections;
    }

    private Connection assembly(Component.Builder composition, Element connector) {
        ConnectionEndpoint provider = innerEndpoint(composition,
            query.findElement(connector, "PROVIDER-IREF"), "TARGET-P-PORT-REF");
        ConnectionEndpoint requester = innerEndpoint(composition,
            query.findElement(connector, "REQUESTER-IREF"), "TARGET-R-PORT-REF");
        return newConnection(composition, connector, ConnectionType.ASSEMBLY, provider, requester);
    }

    private Connection delegation(Component.Builder composition, Element connector) {
        ConnectionEndpoint outer = outerEndpoint(composition, query.getText(connector, "OUTER-PORT-REF"));

        Optional<Element> innerProvided = query.findElement(connector,
            "INNER-PORT-IREF/P-PORT-IN-COMPOSITION-INSTANCE-REF");
        if (innerProvided.isPresent()) {
            ConnectionEndpoint inner = innerEndpoint(composition, innerProvided, "TARGET-P-PORT-REF");
            return newConnection(composition, connector, ConnectionType.DELEGATION, inner, outer);
        }

        Optional<Element> innerRequired = query.findElement(connector,
            "INNER-PORT-IREF/R-PORT-IN-COMPOSITION-INSTANCE-REF");
        ConnectionEndpoint inner = innerEndpoint(composition, innerRequired, "TARGET-R-PORT-REF");
        return newConnection(composition, connector, ConnectionType.DELEGATION, outer, inner);
    }

    private Connection passThrough(Component.Builder composition, Element connector) {
        ConnectionEndpoint provider = outerEndpoint(composition,
            query.getText(connector, "PROVIDED-OUTER-PORT-REF"));
        ConnectionEndpoint requester = outerEndpoint(composition,
            query.getText(connector, "REQUIRED-OUTER-PORT-REF"));
        return newConnection(composition, connector, ConnectionType.PASS_THROUGH, provider, requester);
    }

    private Connection newConnection(Component.Builder composition, Element connector, ConnectionType type,
                                     ConnectionEndpoint provider, ConnectionEndpoint requester) {
        return new Connection(
            UUID.randomUUID().toString(),
            query.getText(connector, "SHORT-NAME"),
            type,
            composition.uuid(),
            provider,
            requester
        );
    }

    /**
     * Resolves an endpoint on a port of one of the composition's prototypes.
     */
    private ConnectionEndpoint innerEndpoint(Component.Builder composition, Optional<Element> instanceRef,
                                             String targetPortTag) {
        String contextRef = instanceRef.map(ref -> query.getText(ref, "CONTEXT-COMPONENT-REF")).orElse("");
        String portRef = instanceRef.map(ref -> query.getText(ref, targetPortTag)).orElse("");
        String prototypeName = ModelIndex.lastSegment(contextRef);
        String portName = ModelIndex.lastSegment(portRef);

        Optional<Component.Builder> type = composition.findPrototype(prototypeName)
            .filter(ComponentPrototype::isResolved)
            .flatMap(prototype -> index.componentByUuid(prototype.componentUuid()));
        debug.recordPrototypeAttempt(type.isPresent());

        String componentUuid = type.map(Component.Builder::uuid).orElse(null);
        String portUuid = type.flatMap(component -> component.findPort(portName)).map(Port::uuid).orElse(null);
        return new ConnectionEndpoint(contextRef, portRef, prototypeName, portName, componentUuid, portUuid);
    }

    /**
     * Resolves an endpoint on a port of the composition itself.
     */
    private ConnectionEndpoint outerEndpoint(Component.Builder composition, String portRef) {
        String portName = ModelIndex.lastSegment(portRef);
        String portUuid = composition.findPort(portName).map(Port::uuid).orElse(null);
        return new ConnectionEndpoint("", portRef, "", portName, composition.uuid(), portUuid);
    }

    private void countUnresolved(Connection connection) {
        for (ConnectionEndpoint endpoint : List.of(connection.provider(), connection.requester())) {
            if (!endpoint.isResolved()) {
                debug.incrementUnresolvedEndpoints();
                log.debug("Unresolved endpoint in connector {}: prototype '{}', port '{}'",
                    connection.shortName(), endpoint.prototypeName(), endpoint.portName());
            }
        }
    }
}
