package com.netconf.yangprinter.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File helpers for writing printed modules.
 */
public class OutputFiles {

    private OutputFiles() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, creating parent directories if needed.
     * An existing file is replaced.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Count physical lines, ignoring a trailing line separator.
     */
    public static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = (int) content.chars().filter(c -> c == '\n').count();
        return content.endsWith("\n") ? lines : lines + 1;
    }
}
