package com.arxmlviewer.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests that model records serialize to their declared fields only.
 */
class ModelJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void component_serializesRecordFieldsWithoutDerivedFlags() {
        Component.Builder builder = new Component.Builder("Sensor", ComponentType.COMPOSITION, null, "/Demo");
        builder.addPort("Out", PortDirection.PROVIDED, null, "/Demo/If");
        builder.addPrototype(new ComponentPrototype("inner", "/Demo/Inner", null));

        JsonNode json = mapper.valueToTree(builder.build());

        assertThat(json.has("shortName")).isTrue();
        assertThat(json.has("composition")).isFalse();
        JsonNode port = json.path("ports").get(0);
        assertThat(port.path("direction").asText()).isEqualTo("PROVIDED");
        assertThat(port.has("provided")).isFalse();
        assertThat(port.has("required")).isFalse();
        assertThat(json.path("prototypes").get(0).has("resolved")).isFalse();
    }

    @Test
    void connection_serializesWithoutResolvedFlags() {
        ConnectionEndpoint provider = new ConnectionEndpoint("/C/a", "/T/P", "a", "P", "c1", "p1");
        ConnectionEndpoint requester = new ConnectionEndpoint("/C/b", "/T/R", "b", "R", null, null);
        Connection connection = new Connection("id", "AtoB", ConnectionType.ASSEMBLY, "comp", provider, requester);

        JsonNode json = mapper.valueToTree(connection);

        assertThat(json.path("connectionType").asText()).isEqualTo("ASSEMBLY");
        assertThat(json.has("resolved")).isFalse();
        assertThat(json.path("provider").has("resolved")).isFalse();
        assertThat(json.path("requester").path("portName").asText()).isEqualTo("R");
    }

    @Test
    void portInterface_serializesNestedOperations() {
        PortInterface portInterface = new PortInterface("id", "DiagIf", InterfaceType.CLIENT_SERVER, null, "/If",
            List.of(), List.of(new Operation("Read", null,
                List.of(new OperationArgument("value", ArgumentDirection.OUT, "/T/uint8", null)))));

        JsonNode argument = mapper.valueToTree(portInterface).path("operations").get(0).path("arguments").get(0);

        assertThat(argument.path("direction").asText()).isEqualTo("OUT");
        assertThat(argument.path("typeRef").asText()).isEqualTo("/T/uint8");
    }
}
