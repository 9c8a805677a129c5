package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * A {@code choice} statement. Its children are the shorthand cases.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ChoiceNode extends ParentNode {

    @Builder
    public ChoiceNode(String name, Status status, Config config, String description, String reference,
                      @Singular List<SchemaNode> children) {
        super(name, status, config, description, reference, children);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CHOICE;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor, int level) {
        visitor.visit(this, level);
    }
}
