package com.netconf.yangprinter.cli.model;

import com.netconf.yangprinter.model.SchemaModule;
import com.netconf.yangprinter.printer.PrinterConfig;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Values derived from {@link PrintOptions} once they passed validation.
 */
@Data
@AllArgsConstructor
public class ValidatedPrintOptions {
    /**
     * Module to print; {@code null} when only listing.
     */
    SchemaModule module;
    /**
     * Normalized output file; {@code null} for standard output.
     */
    Path outputPath;
    PrinterConfig printerConfig;

    public boolean isToStandardOutput() {
        return outputPath == null;
    }
}
