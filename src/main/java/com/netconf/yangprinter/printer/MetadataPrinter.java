package com.netconf.yangprinter.printer;

import com.netconf.yangprinter.model.Config;
import com.netconf.yangprinter.model.Documented;
import com.netconf.yangprinter.model.NodeKind;
import com.netconf.yangprinter.model.SchemaNode;

/**
 * Prints the substatements shared by most statements: config, status,
 * description and reference.
 */
class MetadataPrinter {

    private final StatementWriter out;

    MetadataPrinter(StatementWriter out) {
        this.out = out;
    }

    /**
     * Status, description and reference, each only when present.
     */
    void printCommon(int level, Documented statement) {
        statement.getStatus().getKeyword()
                .ifPresent(keyword -> out.quotedStatement(level, "status", keyword));
        if (statement.getDescription() != null) {
            out.quotedText(level, "description", statement.getDescription());
        }
        if (statement.getReference() != null) {
            out.quotedText(level, "reference", statement.getReference());
        }
    }

    /**
     * Like {@link #printCommon(int, Documented)}, preceded by {@code config}
     * when the node's value differs from the one it inherits. An inherited
     * value is never repeated.
     */
    void printConfigAware(int level, SchemaNode node) {
        if (node.getConfig() != inheritedConfig(node)) {
            node.getConfig().getArgument()
                    .ifPresent(argument -> out.quotedStatement(level, "config", argument));
        }
        printCommon(level, node);
    }

    /**
     * Config of the nearest ancestor that states one. Roots inherit nothing,
     * and the search ends at a grouping, whose contents inherit nothing from outside it.
     */
    static Config inheritedConfig(SchemaNode node) {
        SchemaNode ancestor = node.getParent();
        while (ancestor != null && ancestor.getKind() != NodeKind.GROUPING) {
            if (ancestor.getConfig() != Config.UNSET) {
                return ancestor.getConfig();
            }
            ancestor = ancestor.getParent();
        }
        return Config.UNSET;
    }
}
