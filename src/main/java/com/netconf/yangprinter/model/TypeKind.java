package com.netconf.yangprinter.model;

/**
 * Built-in YANG base types (RFC 6020 section 4.2.4).
 */
public enum TypeKind {
    BINARY("binary"),
    BITS("bits"),
    BOOLEAN("boolean"),
    DECIMAL64("decimal64"),
    EMPTY("empty"),
    ENUMERATION("enumeration"),
    IDENTITYREF("identityref"),
    INSTANCE_IDENTIFIER("instance-identifier"),
    LEAFREF("leafref"),
    STRING("string"),
    UNION("union"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64");

    private final String yangName;

    TypeKind(String yangName) {
        this.yangName = yangName;
    }

    public String getYangName() {
        return yangName;
    }
}
