package com.netconf.yangprinter.cli.exception;

import java.util.List;

/**
 * Raised by the option validator of {@code yang-print}. It holds one message
 * per rejected option, e.g. an unknown module name next to an out-of-range
 * indent, so the command can report them all before exiting.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid yang-print options (" + errors.size() + "): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return the individual messages, in the order the options were checked
     */
    public List<String> getErrors() {
        return errors;
    }
}
