package com.arxmlviewer.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds ARXML files below a directory, case-insensitively by extension.
     *
     * @param rootPath root directory
     * @return ARXML files, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findArxmlFiles(Path rootPath) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(FileUtils::isArxmlFile)
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1) : "";
    }

    public static boolean isArxmlFile(Path path) {
        return "arxml".equals(getExtension(path).toLowerCase(Locale.ROOT));
    }

    /**
     * Formats a byte count for display.
     *
     * @param bytes size in bytes
     * @return e.g. {@code 512 B}, {@code 1.5 KB}, {@code 2.0 MB}
     */
    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
