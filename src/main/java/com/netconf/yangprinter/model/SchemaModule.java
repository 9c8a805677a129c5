package com.netconf.yangprinter.model;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A fully resolved YANG module, the root of the schema tree.
 * <p>
 * The module owns its top-level nodes, typedefs and identities; adding any of
 * them records this module as their owner.
 */
@Data
public class SchemaModule {
    private String name;
    private String namespace;
    private String prefix;
    private YangVersion version;
    private List<Import> imports;
    private List<Include> includes;
    private String organization;
    private String contact;
    private String description;
    private String reference;
    private List<Revision> revisions;
    private List<Identity> identities = new ArrayList<>();
    private List<Typedef> typedefs = new ArrayList<>();
    private List<SchemaNode> nodes = new ArrayList<>();

    @Builder
    public SchemaModule(String name, String namespace, String prefix, YangVersion version,
                        @Singular("moduleImport") List<Import> imports,
                        @Singular List<Include> includes,
                        String organization, String contact, String description, String reference,
                        @Singular List<Revision> revisions,
                        @Singular List<Identity> identities,
                        @Singular List<Typedef> typedefs,
                        @Singular List<SchemaNode> nodes) {
        this.name = name;
        this.namespace = namespace;
        this.prefix = prefix;
        this.version = version;
        this.imports = new ArrayList<>(imports);
        this.includes = new ArrayList<>(includes);
        this.organization = organization;
        this.contact = contact;
        this.description = description;
        this.reference = reference;
        this.revisions = new ArrayList<>(revisions);
        identities.forEach(this::addIdentity);
        typedefs.forEach(this::addTypedef);
        nodes.forEach(this::addNode);
    }

    public void addNode(SchemaNode node) {
        nodes.add(node);
        node.attachTo(this);
    }

    public void addTypedef(Typedef typedef) {
        typedefs.add(typedef);
        typedef.setModule(this);
    }

    public void addIdentity(Identity identity) {
        identities.add(identity);
        identity.setModule(this);
    }

    /**
     * Find a top-level node by name.
     */
    public Optional<SchemaNode> findNode(String nodeName) {
        return nodes.stream()
                .filter(node -> node.getName().equals(nodeName))
                .findFirst();
    }

    public Optional<Typedef> findTypedef(String typedefName) {
        return typedefs.stream()
                .filter(typedef -> typedef.getName().equals(typedefName))
                .findFirst();
    }

    public Optional<Identity> findIdentity(String identityName) {
        return identities.stream()
                .filter(identity -> identity.getName().equals(identityName))
                .findFirst();
    }
}
