package com.netconf.yangprinter.printer;

import com.netconf.yangprinter.model.EnumEntry;
import com.netconf.yangprinter.model.Identity;
import com.netconf.yangprinter.model.Import;
import com.netconf.yangprinter.model.SchemaModule;
import com.netconf.yangprinter.model.SchemaType;
import com.netconf.yangprinter.model.Typedef;
import com.netconf.yangprinter.util.QuotedText;

import java.util.function.IntConsumer;

/**
 * Prints {@code type}, {@code typedef} and {@code identity} statements.
 * <p>
 * Names defined in a module other than the one being printed are qualified
 * with a prefix: the prefix written in the source when the model kept it,
 * otherwise the prefix the printed module imports the owner under, otherwise
 * the owner's own prefix.
 */
class TypePrinter {

    private final StatementWriter out;
    private final MetadataPrinter metadata;
    private final SchemaModule printedModule;

    TypePrinter(StatementWriter out, MetadataPrinter metadata, SchemaModule printedModule) {
        this.out = out;
        this.metadata = metadata;
        this.printedModule = printedModule;
    }

    void printType(int level, SchemaType type) {
        Typedef derived = type.getTypedef();
        String name = qualify(derived.getModule(), printedModule, type.getPrefix(), derived.getName());

        IntConsumer body = switch (type.getKind()) {
            case ENUMERATION -> enumBody(type);
            case IDENTITYREF -> identityrefBody(type);
            // restrictions of these kinds are not printed yet
            case BINARY, BITS, BOOLEAN, DECIMAL64, EMPTY, INSTANCE_IDENTIFIER, LEAFREF, STRING, UNION,
                    INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64 -> null;
        };

        if (body == null) {
            out.statement(level, "type", name);
            return;
        }
        out.openBlock(level, "type", name);
        body.accept(level + 1);
        out.closeBlock(level);
    }

    void printTypedef(int level, Typedef typedef) {
        out.openBlock(level, "typedef", typedef.getName());
        metadata.printCommon(level + 1, typedef);
        if (typedef.getType() != null) {
            printType(level + 1, typedef.getType());
        }
        out.closeBlock(level);
    }

    void printIdentity(int level, Identity identity) {
        out.openBlock(level, "identity", identity.getName());
        metadata.printCommon(level + 1, identity);
        if (identity.hasBase()) {
            printBase(level + 1, identity.getBase(), identity.getModule());
        }
        out.closeBlock(level);
    }

    private IntConsumer enumBody(SchemaType type) {
        if (type.getEnums().isEmpty()) {
            return null;
        }
        return level -> printEnums(level, type);
    }

    private IntConsumer identityrefBody(SchemaType type) {
        if (type.getIdentityBase() == null) {
            return null;
        }
        return level -> printBase(level, type.getIdentityBase(), printedModule);
    }

    private void printEnums(int level, SchemaType type) {
        for (EnumEntry entry : type.getEnums()) {
            out.openBlock(level, "enum", QuotedText.quote(entry.getName()));
            metadata.printCommon(level + 1, entry);
            out.statement(level + 1, "value", Integer.toString(entry.getValue()));
            out.closeBlock(level);
        }
    }

    private void printBase(int level, Identity base, SchemaModule referencingModule) {
        out.statement(level, "base", qualify(base.getModule(), referencingModule, null, base.getName()));
    }

    private String qualify(SchemaModule owner, SchemaModule context, String explicitPrefix, String name) {
        // identity, not equality: each resolved module is a single object
        if (owner == null || owner == context) {
            return name;
        }
        return resolvePrefix(owner, explicitPrefix) + ":" + name;
    }

    private String resolvePrefix(SchemaModule owner, String explicitPrefix) {
        if (explicitPrefix != null && !explicitPrefix.isEmpty()) {
            return explicitPrefix;
        }
        return printedModule.getImports().stream()
                .filter(imported -> imported.getModule() == owner)
                .map(Import::getPrefix)
                .findFirst()
                .orElse(owner.getPrefix());
    }
}
