package com.arxmlviewer.cli;

import com.arxmlviewer.ArxmlViewerCLI;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for command tests: runs the CLI in-process and captures its output.
 */
abstract class CliTestBase {

    protected static final String SAMPLE = """
        <?xml version="1.0" encoding="UTF-8"?>
        <AUTOSAR xmlns="http://autosar.org/schema/r4.0">
          <AR-PACKAGES>
            <AR-PACKAGE>
              <SHORT-NAME>DemoPackage</SHORT-NAME>
              <ELEMENTS>
                <APPLICATION-SW-COMPONENT-TYPE>
                  <SHORT-NAME>SensorComponent</SHORT-NAME>
                  <PORTS>
                    <P-PORT-PROTOTYPE><SHORT-NAME>TemperatureOutput</SHORT-NAME></P-PORT-PROTOTYPE>
                  </PORTS>
                </APPLICATION-SW-COMPONENT-TYPE>
                <APPLICATION-SW-COMPONENT-TYPE>
                  <SHORT-NAME>ControllerComponent</SHORT-NAME>
                  <PORTS>
                    <R-PORT-PROTOTYPE><SHORT-NAME>TemperatureInput</SHORT-NAME></R-PORT-PROTOTYPE>
                  </PORTS>
                </APPLICATION-SW-COMPONENT-TYPE>
                <COMPOSITION-SW-COMPONENT-TYPE>
                  <SHORT-NAME>System</SHORT-NAME>
                  <COMPONENTS>
                    <SW-COMPONENT-PROTOTYPE>
                      <SHORT-NAME>sensor</SHORT-NAME>
                      <TYPE-TREF>/DemoPackage/SensorComponent</TYPE-TREF>
                    </SW-COMPONENT-PROTOTYPE>
                    <SW-COMPONENT-PROTOTYPE>
                      <SHORT-NAME>controller</SHORT-NAME>
                      <TYPE-TREF>/DemoPackage/ControllerComponent</TYPE-TREF>
                    </SW-COMPONENT-PROTOTYPE>
                  </COMPONENTS>
                  <CONNECTORS>
                    <ASSEMBLY-SW-CONNECTOR>
                      <SHORT-NAME>SensorToController</SHORT-NAME>
                      <PROVIDER-IREF>
                        <CONTEXT-COMPONENT-REF>/DemoPackage/System/sensor</CONTEXT-COMPONENT-REF>
                        <TARGET-P-PORT-REF>/DemoPackage/SensorComponent/TemperatureOutput</TARGET-P-PORT-REF>
                      </PROVIDER-IREF>
                      <REQUESTER-IREF>
                        <CONTEXT-COMPONENT-REF>/DemoPackage/System/controller</CONTEXT-COMPONENT-REF>
                        <TARGET-R-PORT-REF>/DemoPackage/ControllerComponent/TemperatureInput</TARGET-R-PORT-REF>
                      </REQUESTER-IREF>
                    </ASSEMBLY-SW-CONNECTOR>
                  </CONNECTORS>
                </COMPOSITION-SW-COMPONENT-TYPE>
              </ELEMENTS>
            </AR-PACKAGE>
          </AR-PACKAGES>
        </AUTOSAR>
        """;

    @TempDir
    protected Path tempDir;

    protected final StringWriter out = new StringWriter();
    protected final StringWriter err = new StringWriter();

    protected int run(String... args) {
        CommandLine commandLine = ArxmlViewerCLI.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    protected Path createFile(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
