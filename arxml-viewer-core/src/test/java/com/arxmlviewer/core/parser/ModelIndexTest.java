package com.arxmlviewer.core.parser;

import com.arxmlviewer.core.model.Component;
import com.arxmlviewer.core.model.ComponentType;
import com.arxmlviewer.core.model.DataElement;
import com.arxmlviewer.core.model.InterfaceType;
import com.arxmlviewer.core.model.PortInterface;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModelIndex}.
 */
class ModelIndexTest {

    @Test
    void findComponent_byFullPath_withOrWithoutLeadingSlash() {
        ModelIndex index = new ModelIndex();
        Component.Builder sensor = new Component.Builder("Sensor", ComponentType.APPLICATION, null, "/Demo");
        index.registerComponent(sensor);

        assertThat(index.findComponent("/Demo/Sensor")).containsSame(sensor);
        assertThat(index.findComponent("Demo/Sensor")).containsSame(sensor);
        assertThat(index.findComponent(" /Demo/Sensor ")).containsSame(sensor);
        assertThat(index.componentByUuid(sensor.uuid())).containsSame(sensor);
    }

    @Test
    void findComponent_unknownPath_fallsBackToUniqueShortName() {
        ModelIndex index = new ModelIndex();
        Component.Builder sensor = new Component.Builder("Sensor", ComponentType.APPLICATION, null, "/Demo");
        index.registerComponent(sensor);

        assertThat(index.findComponent("/Moved/Sensor")).containsSame(sensor);
    }

    @Test
    void findComponent_ambiguousShortName_returnsEmpty() {
        ModelIndex index = new ModelIndex();
        index.registerComponent(new Component.Builder("Sensor", ComponentType.APPLICATION, null, "/A"));
        index.registerComponent(new Component.Builder("Sensor", ComponentType.APPLICATION, null, "/B"));

        assertThat(index.findComponent("/C/Sensor")).isEmpty();
        assertThat(index.findComponent("/B/Sensor")).map(Component.Builder::packagePath).contains("/B");
        assertThat(index.components()).hasSize(2);
    }

    @Test
    void findInterface_blankReference_returnsEmpty() {
        ModelIndex index = new ModelIndex();
        index.registerInterface(new PortInterface("id", "SpeedIf", InterfaceType.SENDER_RECEIVER, null, "/If",
            List.of(new DataElement("Speed", "/Types/SpeedType", null)), List.of()));

        assertThat(index.findInterface(null)).isEmpty();
        assertThat(index.findInterface(" ")).isEmpty();
        assertThat(index.findInterface("/If/SpeedIf")).map(PortInterface::uuid).contains("id");
        assertThat(index.componentByUuid(null)).isEmpty();
    }

    @Test
    void lastSegment_handlesTrailingSlashesAndBareNames() {
        assertThat(ModelIndex.lastSegment("/Pkg/Comp/Port")).isEqualTo("Port");
        assertThat(ModelIndex.lastSegment("/Pkg/Comp/")).isEqualTo("Comp");
        assertThat(ModelIndex.lastSegment("Port")).isEqualTo("Port");
        assertThat(ModelIndex.lastSegment("")).isEmpty();
        assertThat(ModelIndex.lastSegment(null)).isEmpty();
    }
}
