package com.netconf.yangprinter.printer;

/**
 * Thrown when the output sink fails while a module is being printed.
 * The walk is aborted at the failing write.
 */
public class PrinterException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String moduleName;

    public PrinterException(String moduleName, Throwable cause) {
        super("Failed to write module '" + moduleName + "': " + cause.getMessage(), cause);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
