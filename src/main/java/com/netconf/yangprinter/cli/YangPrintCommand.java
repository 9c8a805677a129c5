package com.netconf.yangprinter.cli;

import com.netconf.yangprinter.cli.exception.OptionsValidationException;
import com.netconf.yangprinter.cli.model.PrintOptions;
import com.netconf.yangprinter.cli.model.ValidatedPrintOptions;
import com.netconf.yangprinter.cli.output.PrintResultsPrinter;
import com.netconf.yangprinter.cli.validation.PrintOptionsValidator;
import com.netconf.yangprinter.printer.PrintResult;
import com.netconf.yangprinter.printer.YangPrinter;
import com.netconf.yangprinter.registry.ModuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * CLI command printing a registered module as YANG text.
 */
@Command(
        name = "yang-print",
        mixinStandardHelpOptions = true,
        version = "yang-print 1.0.0",
        description = "Prints a resolved YANG module from the module registry as YANG text."
)
public class YangPrintCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(YangPrintCommand.class);

    @Mixin
    private PrintOptions options;

    @Spec
    private CommandSpec spec;

    private final ModuleRegistry registry;
    private final PrintResultsPrinter results = new PrintResultsPrinter();

    public YangPrintCommand(ModuleRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ValidatedPrintOptions validated;
        try {
            validated = new PrintOptionsValidator(registry).validate(options);
        } catch (OptionsValidationException e) {
            results.printValidationErrors(e);
            return 1;
        }

        if (options.isList()) {
            results.printModules(registry);
            return 0;
        }

        YangPrinter printer = new YangPrinter(validated.getPrinterConfig());
        if (validated.isToStandardOutput()) {
            log.debug("Printing module {} to standard output", validated.getModule().getName());
            PrintWriter stdout = spec.commandLine().getOut();
            int status = printer.print(stdout, validated.getModule());
            // PrintWriter never throws; its error flag is the only trace of a failed write
            if (status == 0 && stdout.checkError()) {
                log.error("Printing module {} failed: standard output is not writable",
                        validated.getModule().getName());
                return 1;
            }
            return status;
        }

        PrintResult result = printer.printToFile(validated.getOutputPath(), validated.getModule());
        if (!result.isSuccess()) {
            results.printFailure(result);
            return 1;
        }
        results.printSuccess(result);
        return 0;
    }
}
