package com.netconf.yangprinter.model;

/**
 * Language version declared by a module's {@code yang-version} statement.
 */
public enum YangVersion {
    V1_0("1.0"),
    V1_1("1.1");

    private final String argument;

    YangVersion(String argument) {
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }
}
