package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * A {@code type} statement as used by a leaf, leaf-list or typedef.
 * <p>
 * {@code kind} is the resolved base type and decides which restrictions apply;
 * {@code typedef} is the definition the statement names. For
 * {@code type enumeration { ... }} both describe the same built-in, while for a
 * reference to {@code ietf-inet-types:ip-address} the typedef comes from the
 * imported module.
 */
@Value
public class SchemaType {
    TypeKind kind;
    Typedef typedef;
    /**
     * Prefix used in the source when the typedef is imported, or {@code null}.
     */
    String prefix;
    List<EnumEntry> enums;
    /**
     * Base identity of an identityref, or {@code null}.
     */
    Identity identityBase;

    @Builder
    public SchemaType(TypeKind kind, Typedef typedef, String prefix,
                      @Singular("enumEntry") List<EnumEntry> enums, Identity identityBase) {
        this.kind = kind;
        this.typedef = typedef != null ? typedef : Typedef.builtIn(kind);
        this.prefix = prefix;
        this.enums = enums;
        this.identityBase = identityBase;
    }

    public static SchemaType of(TypeKind kind) {
        return builder().kind(kind).build();
    }

    /**
     * A type named after a derived typedef, resolving to the typedef's base kind.
     */
    public static SchemaType derivedFrom(Typedef typedef) {
        TypeKind kind = typedef.isBuiltIn() ? builtInKind(typedef) : typedef.getType().getKind();
        return builder().kind(kind).typedef(typedef).build();
    }

    private static TypeKind builtInKind(Typedef builtIn) {
        return Arrays.stream(TypeKind.values())
                .filter(kind -> Typedef.builtIn(kind) == builtIn)
                .findFirst()
                .orElseThrow();
    }

    public String getName() {
        return typedef.getName();
    }
}
