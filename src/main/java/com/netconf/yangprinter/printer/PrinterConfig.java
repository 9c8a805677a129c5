package com.netconf.yangprinter.printer;

import lombok.Builder;
import lombok.Value;

/**
 * Layout settings for the YANG printer.
 */
@Value
@Builder
public class PrinterConfig {

    /**
     * Spaces per nesting level.
     */
    @Builder.Default
    int indentWidth = 2;

    /**
     * Emit an empty line after every quoted text block (description, contact, ...).
     */
    @Builder.Default
    boolean blankLineAfterText = true;

    @Builder.Default
    String lineSeparator = "\n";

    public static PrinterConfig defaults() {
        return builder().build();
    }
}
