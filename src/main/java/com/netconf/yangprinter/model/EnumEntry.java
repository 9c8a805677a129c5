package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Value;

/**
 * One {@code enum} of an enumeration type, with its assigned value.
 */
@Value
@Builder
public class EnumEntry implements Documented {
    String name;
    int value;
    @Builder.Default
    Status status = Status.UNSET;
    String description;
    String reference;
}
