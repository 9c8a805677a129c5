package com.netconf.yangprinter.model;

/**
 * Visitor over the closed set of schema node variants. The {@code level}
 * argument is the nesting depth of the visited node's statement.
 */
public interface SchemaNodeVisitor {
    void visit(ContainerNode container, int level);
    void visit(ChoiceNode choice, int level);
    void visit(LeafNode leaf, int level);
    void visit(LeafListNode leafList, int level);
    void visit(ListNode list, int level);
    void visit(GroupingNode grouping, int level);
    void visit(UsesNode uses, int level);
}
