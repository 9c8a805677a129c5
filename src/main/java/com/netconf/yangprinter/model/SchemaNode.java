package com.netconf.yangprinter.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Base class for all schema tree nodes.
 * <p>
 * The owning module and the parent are back-references: the module owns its
 * top-level nodes and every node owns its children, never the other way
 * round. Both are wired when the node is attached, see
 * {@link ParentNode#addChild(SchemaNode)} and {@link SchemaModule#addNode(SchemaNode)}.
 */
@Data
public abstract sealed class SchemaNode implements Documented
        permits ParentNode, LeafNode, LeafListNode, UsesNode {

    protected String name;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    protected SchemaModule module;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    protected SchemaNode parent;
    protected Status status;
    protected Config config;
    protected String description;
    protected String reference;

    protected SchemaNode(String name, Status status, Config config, String description, String reference) {
        this.name = name;
        this.status = status != null ? status : Status.UNSET;
        this.config = config != null ? config : Config.UNSET;
        this.description = description;
        this.reference = reference;
    }

    public abstract NodeKind getKind();

    public abstract void accept(SchemaNodeVisitor visitor, int level);

    /**
     * Children exposed to a printer. Leaves, leaf-lists and uses have none.
     */
    public List<SchemaNode> getChildren() {
        return List.of();
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Slash-separated path of node names from the module root, e.g. {@code /interfaces/interface/name}.
     */
    public String getSchemaPath() {
        if (parent == null) {
            return "/" + name;
        }
        return parent.getSchemaPath() + "/" + name;
    }

    void attachTo(SchemaModule owner) {
        this.module = owner;
    }
}
