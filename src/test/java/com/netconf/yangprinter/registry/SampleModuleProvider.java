package com.netconf.yangprinter.registry;

import com.netconf.yangprinter.SampleModules;
import com.netconf.yangprinter.model.SchemaModule;

import java.util.List;

/**
 * Test provider registered through {@code META-INF/services}.
 */
public class SampleModuleProvider implements ModuleProvider {

    @Override
    public List<SchemaModule> getModules() {
        SchemaModule types = SampleModules.exampleTypes();
        return List.of(types, SampleModules.exampleSystem(types));
    }
}
