package com.netconf.yangprinter.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options of the {@code yang-print} command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class PrintOptions {

    @Option(names = {"--module", "-m"}, description = "Name of the module to print")
    private String moduleName;

    @Option(names = {"--output", "-o"}, description = "Output file (defaults to standard output)")
    private Path output;

    @Option(names = {"--force", "-f"}, description = "Overwrite an existing output file")
    private boolean force;

    @Option(names = {"--indent"}, defaultValue = "2", description = "Spaces per nesting level (1-8, default: 2)")
    private int indentWidth;

    @Option(names = {"--no-blank-lines"}, description = "Do not separate text blocks with an empty line")
    private boolean noBlankLines;

    @Option(names = {"--list", "-l"}, description = "List the available modules instead of printing one")
    private boolean list;
}
