package com.netconf.yangprinter.cli.output;

import com.netconf.yangprinter.cli.exception.OptionsValidationException;
import com.netconf.yangprinter.model.SchemaModule;
import com.netconf.yangprinter.model.SchemaNode;
import com.netconf.yangprinter.printer.PrintResult;
import com.netconf.yangprinter.registry.ModuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible only for reporting the outcome of the "yang-print" command.
 * No validation, no execution.
 */
public class PrintResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(PrintResultsPrinter.class);

    public void printModules(ModuleRegistry registry) {
        if (registry.isEmpty()) {
            log.info("No modules available. Add a ModuleProvider to the class path.");
            return;
        }
        log.info("Available modules:");
        for (SchemaModule module : registry.getModules()) {
            log.info("  {} ({}) prefix {}", module.getName(), module.getNamespace(), module.getPrefix());
            for (SchemaNode node : module.getNodes()) {
                log.info("    {} {}", node.getKind().getKeyword(), node.getSchemaPath());
            }
        }
    }

    public void printSuccess(PrintResult result) {
        log.info("Module {} written to {} ({} lines)",
                result.getModuleName(), result.getOutputPath().toAbsolutePath(), result.getLineCount());
    }

    public void printFailure(PrintResult result) {
        log.error("Printing module {} failed: {}", result.getModuleName(), result.getErrorMessage());
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        e.getErrors().forEach(error -> log.error("  {}", error));
    }
}
