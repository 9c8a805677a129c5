package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An {@code import} of another module under a local prefix.
 */
@Value
@Builder
public class Import {
    @NonNull
    SchemaModule module;
    @NonNull
    String prefix;
    /**
     * Pinned revision date, or {@code null}.
     */
    String revisionDate;

    public boolean hasRevisionDate() {
        return revisionDate != null && !revisionDate.isEmpty();
    }
}
