package com.arxmlviewer.cli;

import com.arxmlviewer.core.xml.XmlInfo;
import com.arxmlviewer.core.xml.XmlValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to print XML diagnostics (root, namespaces, element count) as JSON.
 */
@Command(
    name = "info",
    description = "Print XML diagnostics for a file as JSON",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InfoCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "File to inspect")
    private Path file;

    @Override
    public Integer call() {
        XmlInfo info = XmlValidator.getXmlInfo(file);
        try {
            spec.commandLine().getOut().println(JsonOutput.write(info));
        } catch (JsonProcessingException e) {
            log.error("JSON serialization failed", e);
            spec.commandLine().getErr().println("✗ Failed to write JSON: " + e.getMessage());
            return 1;
        }
        return info.valid() ? 0 : 1;
    }
}
