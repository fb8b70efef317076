package com.arxmlviewer.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CliTestBase {

    @Test
    void validate_autosarFile_passes() throws IOException {
        Path file = createFile("ok.arxml", SAMPLE);

        int exitCode = run("validate", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("✓ " + file + ": well-formed AUTOSAR XML").contains("All 1 files passed");
    }

    @Test
    void validate_mixedFiles_reportsEachAndFails() throws IOException {
        Path good = createFile("ok.arxml", SAMPLE);
        Path bad = createFile("bad.arxml", "<AUTOSAR>");

        int exitCode = run("validate", good.toString(), bad.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("✗ " + bad + ": not well-formed XML")
            .contains("1 of 2 files failed validation");
    }

    @Test
    void validate_plainXml_warnsUnlessStrict() throws IOException {
        Path file = createFile("pom.xml", "<project/>");

        assertThat(run("validate", file.toString())).isZero();
        assertThat(out.toString()).contains("⚠ " + file);

        assertThat(run("validate", "--strict", file.toString())).isEqualTo(1);
    }
}
