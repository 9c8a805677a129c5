package com.netconf.yangprinter.model;

import com.netconf.yangprinter.SampleModules;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for schema tree wiring and lookups.
 */
class SchemaModelTest {

    @Test
    void testAttachingWiresParentAndModule() {
        LeafNode name = LeafNode.builder().name("name").type(SchemaType.of(TypeKind.STRING)).build();
        ListNode user = ListNode.builder().name("user").key(name).child(name).build();
        ContainerNode system = ContainerNode.builder().name("system").child(user).build();

        assertThat(name.getParent()).isSameAs(user);
        assertThat(user.getParent()).isSameAs(system);
        assertThat(name.getModule()).isNull();

        SchemaModule module = SchemaModule.builder().name("m").namespace("urn:m").prefix("m").node(system).build();

        assertThat(system.isRoot()).isTrue();
        assertThat(system.getModule()).isSameAs(module);
        assertThat(name.getModule()).isSameAs(module);
    }

    @Test
    void testChildAddedAfterAttachInheritsModule() {
        ContainerNode system = ContainerNode.builder().name("system").build();
        SchemaModule module = SchemaModule.builder().name("m").namespace("urn:m").prefix("m").node(system).build();

        LeafNode late = LeafNode.builder().name("late").type(SchemaType.of(TypeKind.STRING)).build();
        system.addChild(late);

        assertThat(late.getModule()).isSameAs(module);
        assertThat(system.getChildren()).containsExactly(late);
    }

    @Test
    void testLocalTypedefsBelongToTheModule() {
        Typedef local = Typedef.builder().name("local").type(SchemaType.of(TypeKind.INT32)).build();
        GroupingNode grouping = GroupingNode.builder().name("g").typedef(local).build();
        SchemaModule module = SchemaModule.builder().name("m").namespace("urn:m").prefix("m").node(grouping).build();

        assertThat(local.getModule()).isSameAs(module);
    }

    @Test
    void testSchemaPath() {
        SchemaModule system = SampleModules.exampleSystem(SampleModules.exampleTypes());
        ContainerNode container = (ContainerNode) system.findNode("system").orElseThrow();
        ListNode user = (ListNode) container.getChildren().get(3);

        assertThat(user.getSchemaPath()).isEqualTo("/system/user");
        assertThat(user.getKeys().get(0).getSchemaPath()).isEqualTo("/system/user/name");
    }

    @Test
    void testLeavesExposeNoChildren() {
        LeafNode leaf = LeafNode.builder().name("l").type(SchemaType.of(TypeKind.STRING)).build();
        UsesNode uses = UsesNode.builder().name("g").build();

        assertThat(leaf.getChildren()).isEmpty();
        assertThat(uses.getChildren()).isEmpty();
    }

    @Test
    void testModuleLookups() {
        SchemaModule types = SampleModules.exampleTypes();

        assertThat(types.findTypedef("percent")).isPresent();
        assertThat(types.findIdentity("crypto-alg").map(Identity::getModule)).containsSame(types);
        assertThat(types.findNode("missing")).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(TypeKind.class)
    void testBuiltInTypedefs(TypeKind kind) {
        Typedef builtIn = Typedef.builtIn(kind);

        assertThat(builtIn.isBuiltIn()).isTrue();
        assertThat(builtIn.getModule()).isNull();
        assertThat(builtIn.getName()).isEqualTo(kind.getYangName());
        assertThat(Typedef.builtIn(kind)).isSameAs(builtIn);
        assertThat(SchemaType.derivedFrom(builtIn).getKind()).isEqualTo(kind);
    }

    @Test
    void testDerivedTypeTakesBaseKindOfTypedef() {
        Typedef percent = SampleModules.exampleTypes().findTypedef("percent").orElseThrow();

        SchemaType type = SchemaType.derivedFrom(percent);

        assertThat(type.getKind()).isEqualTo(TypeKind.UINT8);
        assertThat(type.getName()).isEqualTo("percent");
        assertThat(type.getTypedef().isBuiltIn()).isFalse();
    }

    @Test
    void testStatusAndConfigDefaultToUnset() {
        LeafNode leaf = LeafNode.builder().name("l").type(SchemaType.of(TypeKind.STRING)).build();

        assertThat(leaf.getStatus()).isEqualTo(Status.UNSET);
        assertThat(leaf.getConfig()).isEqualTo(Config.UNSET);
        assertThat(leaf.getStatus().getKeyword()).isEmpty();
        assertThat(Config.READ_ONLY.getArgument()).contains("false");
    }
}
