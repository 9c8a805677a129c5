package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code container} statement.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ContainerNode extends ParentNode implements TypedefScope {

    private List<Typedef> typedefs;

    @Builder
    public ContainerNode(String name, Status status, Config config, String description, String reference,
                         @Singular List<Typedef> typedefs, @Singular List<SchemaNode> children) {
        super(name, status, config, description, reference, children);
        this.typedefs = new ArrayList<>(typedefs);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONTAINER;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor, int level) {
        visitor.visit(this, level);
    }
}
