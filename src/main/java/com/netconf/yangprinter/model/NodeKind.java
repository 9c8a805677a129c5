package com.netconf.yangprinter.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Variant tag of a {@link SchemaNode}, doubling as the statement keyword.
 */
public enum NodeKind {
    CONTAINER("container"),
    CHOICE("choice"),
    LEAF("leaf"),
    LEAF_LIST("leaf-list"),
    LIST("list"),
    GROUPING("grouping"),
    USES("uses");

    /**
     * Kinds allowed at module level and inside containers, lists and groupings.
     */
    public static final Set<NodeKind> DATA_DEFINITIONS =
            EnumSet.of(CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, GROUPING);

    /**
     * Kinds allowed as direct children of a choice.
     */
    public static final Set<NodeKind> CHOICE_CASES =
            EnumSet.of(CONTAINER, LEAF, LEAF_LIST, LIST);

    private final String keyword;

    NodeKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
