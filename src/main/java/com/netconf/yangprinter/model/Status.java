package com.netconf.yangprinter.model;

import java.util.Optional;

/**
 * YANG {@code status} statement values.
 */
public enum Status {
    /**
     * No explicit status in the source; nothing is printed.
     */
    UNSET(null),

    CURRENT("current"),

    DEPRECATED("deprecated"),

    OBSOLETE("obsolete");

    private final String keyword;

    Status(String keyword) {
        this.keyword = keyword;
    }

    public Optional<String> getKeyword() {
        return Optional.ofNullable(keyword);
    }
}
