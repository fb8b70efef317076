package com.arxmlviewer.core.parser;

import com.arxmlviewer.core.model.Component;
import com.arxmlviewer.core.model.ComponentPrototype;
import com.arxmlviewer.core.model.Connection;
import com.arxmlviewer.core.model.ConnectionEndpoint;
import com.arxmlviewer.core.model.ConnectionType;
import com.arxmlviewer.core.model.Port;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for the second parser pass, driven through {@link ArxmlParser}.
 */
class CompositionResolverTest extends ParserTestBase {

    private static final String TYPES = """
        <APPLICATION-SW-COMPONENT-TYPE>
          <SHORT-NAME>Producer</SHORT-NAME>
          <PORTS>
            <P-PORT-PROTOTYPE><SHORT-NAME>Out</SHORT-NAME></P-PORT-PROTOTYPE>
          </PORTS>
        </APPLICATION-SW-COMPONENT-TYPE>
        <APPLICATION-SW-COMPONENT-TYPE>
          <SHORT-NAME>Consumer</SHORT-NAME>
          <PORTS>
            <R-PORT-PROTOTYPE><SHORT-NAME>In</SHORT-NAME></R-PORT-PROTOTYPE>
          </PORTS>
        </APPLICATION-SW-COMPONENT-TYPE>
        """;

    private ArxmlParser parser;

    @BeforeEach
    void setUp() {
        parser = new ArxmlParser();
    }

    @Test
    void assemblyConnector_resolvesBothEndpoints() throws Exception {
        ParseResult result = parse(composition("""
            <ASSEMBLY-SW-CONNECTOR>
              <SHORT-NAME>ProducerToConsumer</SHORT-NAME>
              <PROVIDER-IREF>
                <CONTEXT-COMPONENT-REF>/Pkg/Sys/producer</CONTEXT-COMPONENT-REF>
                <TARGET-P-PORT-REF>/Pkg/Producer/Out</TARGET-P-PORT-REF>
              </PROVIDER-IREF>
              <REQUESTER-IREF>
                <CONTEXT-COMPONENT-REF>/Pkg/Sys/consumer</CONTEXT-COMPONENT-REF>
                <TARGET-R-PORT-REF>/Pkg/Consumer/In</TARGET-R-PORT-REF>
              </REQUESTER-IREF>
            </ASSEMBLY-SW-CONNECTOR>
            """));
        Component producer = component(result, "Producer");
        Component consumer = component(result, "Consumer");
        Component system = component(result, "Sys");

        Connection connection = single(parser.getParsedConnections());

        assertThat(connection.shortName()).isEqualTo("ProducerToConsumer");
        assertThat(connection.connectionType()).isEqualTo(ConnectionType.ASSEMBLY);
        assertThat(connection.compositionUuid()).isEqualTo(system.uuid());
        assertThat(connection.isResolved()).isTrue();
        assertThat(connection.provider().prototypeName()).isEqualTo("producer");
        assertThat(connection.provider().componentUuid()).isEqualTo(producer.uuid());
        assertThat(connection.provider().portUuid()).isEqualTo(producer.findPort("Out").map(Port::uuid).orElseThrow());
        assertThat(connection.requester().componentUuid()).isEqualTo(consumer.uuid());
        assertThat(connection.requester().portName()).isEqualTo("In");
        assertThat(system.prototypes())
            .extracting(ComponentPrototype::shortName, ComponentPrototype::componentUuid)
            .containsExactly(
                tuple("producer", producer.uuid()),
                tuple("consumer", consumer.uuid()));

        DebugInfo debug = result.metadata().debugInfo();
        assertThat(debug.prototypesAttempted()).isEqualTo(4);
        assertThat(debug.prototypesSuccessful()).isEqualTo(4);
        assertThat(debug.unresolvedEndpoints()).isZero();
    }

    @Test
    void assemblyConnector_danglingPrototype_isKeptUnresolved() throws Exception {
        ParseResult result = parse(composition("""
            <ASSEMBLY-SW-CONNECTOR>
              <SHORT-NAME>GhostToConsumer</SHORT-NAME>
              <PROVIDER-IREF>
                <CONTEXT-COMPONENT-REF>/Pkg/Sys/ghost</CONTEXT-COMPONENT-REF>
                <TARGET-P-PORT-REF>/Pkg/Producer/Out</TARGET-P-PORT-REF>
              </PROVIDER-IREF>
              <REQUESTER-IREF>
                <CONTEXT-COMPONENT-REF>/Pkg/Sys/consumer</CONTEXT-COMPONENT-REF>
                <TARGET-R-PORT-REF>/Pkg/Consumer/In</TARGET-R-PORT-REF>
              </REQUESTER-IREF>
            </ASSEMBLY-SW-CONNECTOR>
            """));

        Connection connection = single(parser.getParsedConnections());

        assertThat(connection.isResolved()).isFalse();
        assertThat(connection.provider().isResolved()).isFalse();
        assertThat(connection.provider().componentUuid()).isNull();
        assertThat(connection.provider().contextRef()).isEqualTo("/Pkg/Sys/ghost");
        assertThat(connection.provider().prototypeName()).isEqualTo("ghost");
        assertThat(connection.requester().isResolved()).isTrue();

        DebugInfo debug = result.metadata().debugInfo();
        assertThat(debug.prototypesAttempted()).isGreaterThan(debug.prototypesSuccessful());
        assertThat(debug.unresolvedEndpoints()).isEqualTo(1);
        assertThat(result.metadata().statistics().connectionsParsed()).isEqualTo(1);
    }

    @Test
    void assemblyConnector_missingPort_keepsComponentButNotPort() throws Exception {
        parse(composition("""
            <ASSEMBLY-SW-CONNECTOR>
              <SHORT-NAME>BadPort</SHORT-NAME>
              <PROVIDER-IREF>
                <CONTEXT-COMPONENT-REF>/Pkg/Sys/producer</CONTEXT-COMPONENT-REF>
                <TARGET-P-PORT-REF>/Pkg/Producer/DoesNotExist</TARGET-P-PORT-REF>
              </PROVIDER-IREF>
              <REQUESTER-IREF>
                <CONTEXT-COMPONENT-REF>/Pkg/Sys/consumer</CONTEXT-COMPONENT-REF>
                <TARGET-R-PORT-REF>/Pkg/Consumer/In</TARGET-R-PORT-REF>
              </REQUESTER-IREF>
            </ASSEMBLY-SW-CONNECTOR>
            """));

        ConnectionEndpoint provider = single(parser.getParsedConnections()).provider();

        assertThat(provider.componentUuid()).isNotNull();
        assertThat(provider.portUuid()).isNull();
        assertThat(provider.portName()).isEqualTo("DoesNotExist");
        assertThat(provider.isResolved()).isFalse();
    }

    @Test
    void delegationConnector_innerRequiredPort_outerIsProvider() throws Exception {
        ParseResult result = parse(composition("""
            <DELEGATION-SW-CONNECTOR>
              <SHORT-NAME>OuterToConsumer</SHORT-NAME>
              <INNER-PORT-IREF>
                <R-PORT-IN-COMPOSITION-INSTANCE-REF>
                  <CONTEXT-COMPONENT-REF>/Pkg/Sys/consumer</CONTEXT-COMPONENT-REF>
                  <TARGET-R-PORT-REF>/Pkg/Consumer/In</TARGET-R-PORT-REF>
                </R-PORT-IN-COMPOSITION-INSTANCE-REF>
              </INNER-PORT-IREF>
              <OUTER-PORT-REF>/Pkg/Sys/SysIn</OUTER-PORT-REF>
            </DELEGATION-SW-CONNECTOR>
            """));
        Component system = component(result, "Sys");

        Connection connection = single(parser.getParsedConnections());

        assertThat(connection.connectionType()).isEqualTo(ConnectionType.DELEGATION);
        assertThat(connection.isResolved()).isTrue();
        assertThat(connection.provider().componentUuid()).isEqualTo(system.uuid());
        assertThat(connection.provider().portUuid()).isEqualTo(system.findPort("SysIn").map(Port::uuid).orElseThrow());
        assertThat(connection.provider().contextRef()).isEmpty();
        assertThat(connection.requester().componentUuid()).isEqualTo(component(result, "Consumer").uuid());
    }

    @Test
    void delegationConnector_innerProvidedPort_innerIsProvider() throws Exception {
        ParseResult result = parse(composition("""
            <DELEGATION-SW-CONNECTOR>
              <SHORT-NAME>ProducerToOuter</SHORT-NAME>
              <INNER-PORT-IREF>
                <P-PORT-IN-COMPOSITION-INSTANCE-REF>
                  <CONTEXT-COMPONENT-REF>/Pkg/Sys/producer</CONTEXT-COMPONENT-REF>
                  <TARGET-P-PORT-REF>/Pkg/Producer/Out</TARGET-P-PORT-REF>
                </P-PORT-IN-COMPOSITION-INSTANCE-REF>
              </INNER-PORT-IREF>
              <OUTER-PORT-REF>/Pkg/Sys/SysOut</OUTER-PORT-REF>
            </DELEGATION-SW-CONNECTOR>
            """));

        Connection connection = single(parser.getParsedConnections());

        assertThat(connection.isResolved()).isTrue();
        assertThat(connection.provider().componentUuid()).isEqualTo(component(result, "Producer").uuid());
        assertThat(connection.requester().componentUuid()).isEqualTo(component(result, "Sys").uuid());
        assertThat(connection.requester().portName()).isEqualTo("SysOut");
    }

    @Test
    void passThroughConnector_linksTwoOuterPorts() throws Exception {
        ParseResult result = parse(composition("""
            <PASS-THROUGH-SW-CONNECTOR>
              <SHORT-NAME>Bypass</SHORT-NAME>
              <PROVIDED-OUTER-PORT-REF>/Pkg/Sys/SysOut</PROVIDED-OUTER-PORT-REF>
              <REQUIRED-OUTER-PORT-REF>/Pkg/Sys/SysIn</REQUIRED-OUTER-PORT-REF>
            </PASS-THROUGH-SW-CONNECTOR>
            """));
        Component system = component(result, "Sys");

        Connection connection = single(parser.getParsedConnections());

        assertThat(connection.connectionType()).isEqualTo(ConnectionType.PASS_THROUGH);
        assertThat(connection.isResolved()).isTrue();
        assertThat(connection.provider().portName()).isEqualTo("SysOut");
        assertThat(connection.requester().portName()).isEqualTo("SysIn");
        assertThat(connection.involvesComponent(system.uuid())).isTrue();
        assertThat(result.metadata().debugInfo().prototypesAttempted()).isEqualTo(2);
    }

    @Test
    void unknownConnectorTag_isSkippedAndCounted() throws Exception {
        ParseResult result = parse(composition("""
            <FUTURE-SW-CONNECTOR>
              <SHORT-NAME>Later</SHORT-NAME>
            </FUTURE-SW-CONNECTOR>
            """));

        assertThat(parser.getParsedConnections()).isEmpty();
        assertThat(result.metadata().debugInfo().skippedTags()).containsEntry("FUTURE-SW-CONNECTOR", 1);
    }

    @Test
    void prototypeWithUnknownType_staysUnresolved() throws Exception {
        Path file = createFile("unknown-type.arxml", arxml("""
            <AR-PACKAGE>
              <SHORT-NAME>Pkg</SHORT-NAME>
              <ELEMENTS>
                <COMPOSITION-SW-COMPONENT-TYPE>
                  <SHORT-NAME>Sys</SHORT-NAME>
                  <COMPONENTS>
                    <SW-COMPONENT-PROTOTYPE>
                      <SHORT-NAME>orphan</SHORT-NAME>
                      <TYPE-TREF>/Elsewhere/Missing</TYPE-TREF>
                    </SW-COMPONENT-PROTOTYPE>
                  </COMPONENTS>
                </COMPOSITION-SW-COMPONENT-TYPE>
              </ELEMENTS>
            </AR-PACKAGE>
            """));

        ParseResult result = parser.parseFile(file);

        ComponentPrototype orphan = component(result, "Sys").prototypes().get(0);
        assertThat(orphan.isResolved()).isFalse();
        assertThat(orphan.typeRef()).isEqualTo("/Elsewhere/Missing");
        assertThat(result.metadata().debugInfo().prototypesAttempted()).isEqualTo(1);
        assertThat(result.metadata().debugInfo().prototypesSuccessful()).isZero();
    }

    @Test
    void prototypeTypeDeclaredLaterInDocument_isResolved() throws Exception {
        Path file = createFile("forward.arxml", arxml("""
            <AR-PACKAGE>
              <SHORT-NAME>Systems</SHORT-NAME>
              <ELEMENTS>
                <COMPOSITION-SW-COMPONENT-TYPE>
                  <SHORT-NAME>Sys</SHORT-NAME>
                  <COMPONENTS>
                    <SW-COMPONENT-PROTOTYPE>
                      <SHORT-NAME>late</SHORT-NAME>
                      <TYPE-TREF>/Types/Late</TYPE-TREF>
                    </SW-COMPONENT-PROTOTYPE>
                  </COMPONENTS>
                </COMPOSITION-SW-COMPONENT-TYPE>
              </ELEMENTS>
            </AR-PACKAGE>
            <AR-PACKAGE>
              <SHORT-NAME>Types</SHORT-NAME>
              <ELEMENTS>
                <APPLICATION-SW-COMPONENT-TYPE><SHORT-NAME>Late</SHORT-NAME></APPLICATION-SW-COMPONENT-TYPE>
              </ELEMENTS>
            </AR-PACKAGE>
            """));

        ParseResult result = parser.parseFile(file);

        assertThat(component(result, "Sys").prototypes().get(0).componentUuid())
            .isEqualTo(component(result, "Late").uuid());
    }

    private ParseResult parse(String compositionXml) throws Exception {
        Path file = createFile("composition.arxml", arxml("""
            <AR-PACKAGE>
              <SHORT-NAME>Pkg</SHORT-NAME>
              <ELEMENTS>
            %s
            %s
              </ELEMENTS>
            </AR-PACKAGE>
            """.formatted(TYPES, compositionXml)));
        return parser.parseFile(file);
    }

    private static String composition(String connectors) {
        return """
            <COMPOSITION-SW-COMPONENT-TYPE>
              <SHORT-NAME>Sys</SHORT-NAME>
              <PORTS>
                <P-PORT-PROTOTYPE><SHORT-NAME>SysOut</SHORT-NAME></P-PORT-PROTOTYPE>
                <R-PORT-PROTOTYPE><SHORT-NAME>SysIn</SHORT-NAME></R-PORT-PROTOTYPE>
              </PORTS>
              <COMPONENTS>
                <SW-COMPONENT-PROTOTYPE>
                  <SHORT-NAME>producer</SHORT-NAME>
                  <TYPE-TREF DEST="APPLICATION-SW-COMPONENT-TYPE">/Pkg/Producer</TYPE-TREF>
                </SW-COMPONENT-PROTOTYPE>
                <SW-COMPONENT-PROTOTYPE>
                  <SHORT-NAME>consumer</SHORT-NAME>
                  <TYPE-TREF DEST="APPLICATION-SW-COMPONENT-TYPE">/Pkg/Consumer</TYPE-TREF>
                </SW-COMPONENT-PROTOTYPE>
              </COMPONENTS>
              <CONNECTORS>
            %s
              </CONNECTORS>
            </COMPOSITION-SW-COMPONENT-TYPE>
            """.formatted(connectors);
    }

    private static Component component(ParseResult result, String name) {
        return result.allComponents().stream()
            .filter(component -> component.shortName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No component named " + name));
    }

    private static Connection single(List<Connection> connections) {
        assertThat(connections).hasSize(1);
        return connections.get(0);
    }
}
