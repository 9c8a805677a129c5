package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A {@code leaf-list} statement.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class LeafListNode extends SchemaNode {

    private SchemaType type;

    @Builder
    public LeafListNode(String name, Status status, Config config, String description, String reference,
                        SchemaType type) {
        super(name, status, config, description, reference);
        this.type = type;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LEAF_LIST;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor, int level) {
        visitor.visit(this, level);
    }
}
