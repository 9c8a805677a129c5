package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A {@code uses} statement. The name is the referenced grouping's name as it
 * appears in the source, prefix included.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class UsesNode extends SchemaNode {

    @Builder
    public UsesNode(String name, Status status, String description, String reference) {
        super(name, status, Config.UNSET, description, reference);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USES;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor, int level) {
        visitor.visit(this, level);
    }
}
