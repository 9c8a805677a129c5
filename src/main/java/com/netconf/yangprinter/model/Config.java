package com.netconf.yangprinter.model;

import java.util.Optional;

/**
 * Configuration applicability of a data node ({@code config} statement).
 */
public enum Config {
    /**
     * Not stated on the node; inherited from its parent.
     */
    UNSET(null),

    /**
     * Configuration data ({@code config "true"}).
     */
    WRITABLE("true"),

    /**
     * State data ({@code config "false"}).
     */
    READ_ONLY("false");

    private final String argument;

    Config(String argument) {
        this.argument = argument;
    }

    public Optional<String> getArgument() {
        return Optional.ofNullable(argument);
    }
}
