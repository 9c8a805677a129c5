package com.netconf.yangprinter.model;

/**
 * Statements that carry the common status, description and reference
 * substatements.
 */
public interface Documented {

    Status getStatus();

    /**
     * @return the description text, or {@code null} when absent
     */
    String getDescription();

    /**
     * @return the reference text, or {@code null} when absent
     */
    String getReference();
}
