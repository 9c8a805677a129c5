package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An {@code identity} statement.
 */
@Data
public class Identity implements Documented {

    private String name;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private SchemaModule module;
    private Status status;
    private String description;
    private String reference;
    private Identity base;

    @Builder
    public Identity(String name, SchemaModule module, Status status, String description, String reference,
                    Identity base) {
        this.name = name;
        this.module = module;
        this.status = status != null ? status : Status.UNSET;
        this.description = description;
        this.reference = reference;
        this.base = base;
    }

    public boolean hasBase() {
        return base != null;
    }
}
