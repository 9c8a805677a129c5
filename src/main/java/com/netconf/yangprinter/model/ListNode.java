package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code list} statement.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ListNode extends ParentNode implements TypedefScope {

    /**
     * Key leaves in declared order. Each one is also one of this list's children.
     */
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private List<LeafNode> keys;
    private List<Typedef> typedefs;

    @Builder
    public ListNode(String name, Status status, Config config, String description, String reference,
                    @Singular List<LeafNode> keys, @Singular List<Typedef> typedefs,
                    @Singular List<SchemaNode> children) {
        super(name, status, config, description, reference, children);
        this.keys = new ArrayList<>(keys);
        this.typedefs = new ArrayList<>(typedefs);
    }

    public boolean hasKeys() {
        return !keys.isEmpty();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor, int level) {
        visitor.visit(this, level);
    }
}
