package com.netconf.yangprinter.printer;

import com.netconf.yangprinter.model.ChoiceNode;
import com.netconf.yangprinter.model.ContainerNode;
import com.netconf.yangprinter.model.GroupingNode;
import com.netconf.yangprinter.model.LeafListNode;
import com.netconf.yangprinter.model.LeafNode;
import com.netconf.yangprinter.model.ListNode;
import com.netconf.yangprinter.model.NodeKind;
import com.netconf.yangprinter.model.SchemaNode;
import com.netconf.yangprinter.model.SchemaNodeVisitor;
import com.netconf.yangprinter.model.TypedefScope;
import com.netconf.yangprinter.model.UsesNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dispatches schema nodes to the printer of their variant and prints their
 * subtrees.
 */
class NodePrinter implements SchemaNodeVisitor {

    private static final Logger log = LoggerFactory.getLogger(NodePrinter.class);

    private final StatementWriter out;
    private final MetadataPrinter metadata;
    private final TypePrinter types;

    NodePrinter(StatementWriter out, MetadataPrinter metadata, TypePrinter types) {
        this.out = out;
        this.metadata = metadata;
        this.types = types;
    }

    /**
     * Print {@code node} if its kind is in {@code allowed}. Other kinds are
     * not legal at this position and are skipped without error.
     */
    void dispatch(int level, SchemaNode node, Set<NodeKind> allowed) {
        if (!allowed.contains(node.getKind())) {
            log.debug("Skipping {} {}: not allowed here", node.getKind().getKeyword(), node.getSchemaPath());
            return;
        }
        node.accept(this, level);
    }

    @Override
    public void visit(ContainerNode container, int level) {
        open(level, container);
        metadata.printConfigAware(level + 1, container);
        printTypedefs(level + 1, container);
        printChildren(level + 1, container, NodeKind.DATA_DEFINITIONS);
        out.closeBlock(level);
    }

    @Override
    public void visit(ChoiceNode choice, int level) {
        open(level, choice);
        metadata.printConfigAware(level + 1, choice);
        printChildren(level + 1, choice, NodeKind.CHOICE_CASES);
        out.closeBlock(level);
    }

    @Override
    public void visit(LeafNode leaf, int level) {
        open(level, leaf);
        metadata.printConfigAware(level + 1, leaf);
        types.printType(level + 1, leaf.getType());
        out.closeBlock(level);
    }

    @Override
    public void visit(LeafListNode leafList, int level) {
        open(level, leafList);
        metadata.printConfigAware(level + 1, leafList);
        types.printType(level + 1, leafList.getType());
        out.closeBlock(level);
    }

    @Override
    public void visit(ListNode list, int level) {
        open(level, list);
        metadata.printConfigAware(level + 1, list);
        if (list.hasKeys()) {
            String keys = list.getKeys().stream()
                    .map(SchemaNode::getName)
                    .collect(Collectors.joining(" "));
            out.quotedStatement(level + 1, "key", keys);
        }
        printTypedefs(level + 1, list);
        printChildren(level + 1, list, NodeKind.DATA_DEFINITIONS);
        out.closeBlock(level);
    }

    @Override
    public void visit(GroupingNode grouping, int level) {
        open(level, grouping);
        metadata.printCommon(level + 1, grouping);
        printTypedefs(level + 1, grouping);
        printChildren(level + 1, grouping, NodeKind.DATA_DEFINITIONS);
        out.closeBlock(level);
    }

    @Override
    public void visit(UsesNode uses, int level) {
        open(level, uses);
        metadata.printCommon(level + 1, uses);
        out.closeBlock(level);
    }

    private void open(int level, SchemaNode node) {
        out.openBlock(level, node.getKind().getKeyword(), node.getName());
    }

    private void printTypedefs(int level, TypedefScope scope) {
        scope.getTypedefs().forEach(typedef -> types.printTypedef(level, typedef));
    }

    private void printChildren(int level, SchemaNode node, Set<NodeKind> allowed) {
        for (SchemaNode child : node.getChildren()) {
            dispatch(level, child, allowed);
        }
    }
}
