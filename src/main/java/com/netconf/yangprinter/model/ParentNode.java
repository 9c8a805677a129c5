package com.netconf.yangprinter.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A node that owns an ordered sequence of child nodes.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract sealed class ParentNode extends SchemaNode
        permits ContainerNode, ChoiceNode, ListNode, GroupingNode {

    private List<SchemaNode> children = new ArrayList<>();

    protected ParentNode(String name, Status status, Config config, String description, String reference,
                         List<SchemaNode> children) {
        super(name, status, config, description, reference);
        if (children != null) {
            children.forEach(this::addChild);
        }
    }

    public void addChild(SchemaNode child) {
        children.add(child);
        child.setParent(this);
        if (module != null) {
            child.attachTo(module);
        }
    }

    @Override
    void attachTo(SchemaModule owner) {
        super.attachTo(owner);
        if (this instanceof TypedefScope scope) {
            scope.getTypedefs().forEach(typedef -> typedef.setModule(owner));
        }
        for (SchemaNode child : children) {
            child.attachTo(owner);
        }
    }
}
