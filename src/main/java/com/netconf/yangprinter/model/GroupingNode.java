package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code grouping} statement. Groupings have no config applicability.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class GroupingNode extends ParentNode implements TypedefScope {

    private List<Typedef> typedefs;

    @Builder
    public GroupingNode(String name, Status status, String description, String reference,
                        @Singular List<Typedef> typedefs, @Singular List<SchemaNode> children) {
        super(name, status, Config.UNSET, description, reference, children);
        this.typedefs = new ArrayList<>(typedefs);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GROUPING;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor, int level) {
        visitor.visit(this, level);
    }
}
