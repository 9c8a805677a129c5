package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A {@code typedef}, or the definition of one of the built-in types.
 * <p>
 * Built-in definitions belong to no module and have no contained type.
 */
@Data
public class Typedef implements Documented {

    private static final Map<TypeKind, Typedef> BUILT_INS = createBuiltIns();

    private String name;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private SchemaModule module;
    private Status status;
    private String description;
    private String reference;
    private SchemaType type;
    private final boolean builtIn;

    @Builder
    public Typedef(String name, SchemaModule module, Status status, String description, String reference,
                   SchemaType type) {
        this(name, module, status, description, reference, type, false);
    }

    private Typedef(String name, SchemaModule module, Status status, String description, String reference,
                    SchemaType type, boolean builtIn) {
        this.name = name;
        this.module = module;
        this.status = status != null ? status : Status.UNSET;
        this.description = description;
        this.reference = reference;
        this.type = type;
        this.builtIn = builtIn;
    }

    /**
     * Shared definition of a built-in type, e.g. {@code string} or {@code enumeration}.
     */
    public static Typedef builtIn(TypeKind kind) {
        return BUILT_INS.get(kind);
    }

    private static Map<TypeKind, Typedef> createBuiltIns() {
        Map<TypeKind, Typedef> builtIns = new EnumMap<>(TypeKind.class);
        for (TypeKind kind : TypeKind.values()) {
            builtIns.put(kind, new Typedef(kind.getYangName(), null, Status.UNSET, null, null, null, true));
        }
        return Collections.unmodifiableMap(builtIns);
    }
}
