package com.netconf.yangprinter.printer;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Outcome of printing a module to a file.
 */
@Data
@Builder
public class PrintResult {
    private boolean success;
    private String moduleName;
    private String errorMessage;
    private Path outputPath;
    private int lineCount;

    public static PrintResult failure(String moduleName, String errorMessage) {
        return PrintResult.builder()
                .success(false)
                .moduleName(moduleName)
                .errorMessage(errorMessage)
                .build();
    }
}
