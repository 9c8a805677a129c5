package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One entry of a module's revision history.
 */
@Value
@Builder
public class Revision {
    @NonNull
    String date;
    String description;
    String reference;

    /**
     * Whether the revision needs a block rather than a single statement.
     */
    public boolean hasSubstatements() {
        return description != null || reference != null;
    }
}
