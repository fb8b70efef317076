package com.arxmlviewer.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findArxmlFiles_nestedDirectories_returnsSortedMatches() throws IOException {
        Path top = tempDir.resolve("b.arxml");
        Path nested = tempDir.resolve("sub/a.ARXML");
        Files.createDirectories(nested.getParent());
        Files.writeString(top, "<AUTOSAR/>");
        Files.writeString(nested, "<AUTOSAR/>");
        Files.writeString(tempDir.resolve("readme.txt"), "test");

        List<Path> files = FileUtils.findArxmlFiles(tempDir);

        assertThat(files).containsExactly(top, nested);
    }

    @Test
    void findArxmlFiles_missingDirectory_throws() {
        assertThatThrownBy(() -> FileUtils.findArxmlFiles(tempDir.resolve("missing")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void getExtension_variousNames() {
        assertThat(FileUtils.getExtension(Path.of("system.arxml"))).isEqualTo("arxml");
        assertThat(FileUtils.getExtension(Path.of("archive.tar.gz"))).isEqualTo("gz");
        assertThat(FileUtils.getExtension(Path.of(".hidden"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
    }

    @Test
    void isArxmlFile_isCaseInsensitive() {
        assertThat(FileUtils.isArxmlFile(Path.of("a.ARXML"))).isTrue();
        assertThat(FileUtils.isArxmlFile(Path.of("a.xml"))).isFalse();
    }

    @Test
    void formatSize_scalesUnits() {
        assertThat(FileUtils.formatSize(512)).isEqualTo("512 B");
        assertThat(FileUtils.formatSize(1536)).isEqualTo("1.5 KB");
        assertThat(FileUtils.formatSize(2L * 1024 * 1024)).isEqualTo("2.0 MB");
    }
}
