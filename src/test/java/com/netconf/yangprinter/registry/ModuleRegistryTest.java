package com.netconf.yangprinter.registry;

import com.netconf.yangprinter.model.SchemaModule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModuleRegistry.
 */
class ModuleRegistryTest {

    @Test
    void testLoadDiscoversServiceProviders() {
        ModuleRegistry registry = ModuleRegistry.load();

        assertThat(registry.getModuleNames()).containsExactly("example-types", "example-system");
        assertThat(registry.find("example-system")).isPresent();
        assertThat(registry.find("example-system").get().getPrefix()).isEqualTo("sys");
    }

    @Test
    void testUnknownModuleIsEmpty() {
        ModuleRegistry registry = new ModuleRegistry(List.<ModuleProvider>of());

        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    void testDuplicateModuleNameKeepsFirst() {
        SchemaModule first = SchemaModule.builder().name("dup").namespace("urn:first").prefix("a").build();
        SchemaModule second = SchemaModule.builder().name("dup").namespace("urn:second").prefix("b").build();

        ModuleRegistry registry = new ModuleRegistry(List.<ModuleProvider>of(
                () -> List.of(first),
                () -> List.of(second)));

        assertThat(registry.getModules()).hasSize(1);
        assertThat(registry.find("dup")).containsSame(first);
    }
}
