package com.netconf.yangprinter.printer;

import com.netconf.yangprinter.model.Identity;
import com.netconf.yangprinter.model.Import;
import com.netconf.yangprinter.model.Include;
import com.netconf.yangprinter.model.NodeKind;
import com.netconf.yangprinter.model.Revision;
import com.netconf.yangprinter.model.SchemaModule;
import com.netconf.yangprinter.model.SchemaNode;
import com.netconf.yangprinter.model.Typedef;
import com.netconf.yangprinter.util.QuotedText;

import java.io.Writer;

/**
 * Prints one module: header, linkage, meta, revisions, identities, typedefs
 * and the top-level data definitions, in that order.
 * <p>
 * An emitter serves a single print call; the nesting level is passed down
 * the walk rather than kept as state.
 */
class ModuleEmitter {

    private final SchemaModule module;
    private final StatementWriter out;
    private final MetadataPrinter metadata;
    private final TypePrinter types;
    private final NodePrinter nodes;

    ModuleEmitter(Writer sink, SchemaModule module, PrinterConfig config) {
        this.module = module;
        this.out = new StatementWriter(sink, config, module.getName());
        this.metadata = new MetadataPrinter(out);
        this.types = new TypePrinter(out, metadata, module);
        this.nodes = new NodePrinter(out, metadata, types);
    }

    void emit() {
        out.openBlock(0, "module", module.getName());
        printHeader(1);
        printLinkage(1);
        printMeta(1);
        printRevisions(1);

        for (Identity identity : module.getIdentities()) {
            types.printIdentity(1, identity);
        }
        for (Typedef typedef : module.getTypedefs()) {
            types.printTypedef(1, typedef);
        }
        for (SchemaNode node : module.getNodes()) {
            nodes.dispatch(1, node, NodeKind.DATA_DEFINITIONS);
        }

        out.closeBlock(0);
        out.flush();
    }

    private void printHeader(int level) {
        out.quotedStatement(level, "namespace", module.getNamespace());
        out.quotedStatement(level, "prefix", module.getPrefix());
        if (module.getVersion() != null) {
            out.quotedStatement(level, "yang-version", module.getVersion().getArgument());
        }
    }

    private void printLinkage(int level) {
        for (Import imported : module.getImports()) {
            out.openBlock(level, "import", imported.getModule().getName());
            out.quotedStatement(level + 1, "prefix", imported.getPrefix());
            if (imported.hasRevisionDate()) {
                out.quotedStatement(level + 1, "revision-date", imported.getRevisionDate());
            }
            out.closeBlock(level);
        }
        for (Include include : module.getIncludes()) {
            if (include.hasRevisionDate()) {
                out.openBlock(level, "include", include.getSubmodule());
                out.quotedStatement(level + 1, "revision-date", include.getRevisionDate());
                out.closeBlock(level);
            } else {
                out.statement(level, "include", include.getSubmodule());
            }
        }
    }

    private void printMeta(int level) {
        if (module.getOrganization() != null) {
            out.quotedText(level, "organization", module.getOrganization());
        }
        if (module.getContact() != null) {
            out.quotedText(level, "contact", module.getContact());
        }
        if (module.getDescription() != null) {
            out.quotedText(level, "description", module.getDescription());
        }
        if (module.getReference() != null) {
            out.quotedText(level, "reference", module.getReference());
        }
    }

    private void printRevisions(int level) {
        for (Revision revision : module.getRevisions()) {
            if (!revision.hasSubstatements()) {
                out.quotedStatement(level, "revision", revision.getDate());
                continue;
            }
            out.openBlock(level, "revision", QuotedText.quote(revision.getDate()));
            if (revision.getDescription() != null) {
                out.quotedText(level + 1, "description", revision.getDescription());
            }
            if (revision.getReference() != null) {
                out.quotedText(level + 1, "reference", revision.getReference());
            }
            out.closeBlock(level);
        }
    }
}
