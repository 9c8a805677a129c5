package com.netconf.yangprinter;

import com.netconf.yangprinter.cli.YangPrintCommand;
import com.netconf.yangprinter.registry.ModuleRegistry;
import picocli.CommandLine;

/**
 * Main entry point of the YANG printer command line.
 * Modules come from the {@link com.netconf.yangprinter.registry.ModuleProvider}s on the class path.
 */
public class YangPrinterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new YangPrintCommand(ModuleRegistry.load()))
                .execute(args);
        System.exit(exitCode);
    }
}
