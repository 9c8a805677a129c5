package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An {@code include} of a submodule.
 */
@Value
@Builder
public class Include {
    @NonNull
    String submodule;
    /**
     * Pinned revision date, or {@code null}.
     */
    String revisionDate;

    public boolean hasRevisionDate() {
        return revisionDate != null && !revisionDate.isEmpty();
    }
}
