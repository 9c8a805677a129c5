package com.netconf.yangprinter.registry;

import com.netconf.yangprinter.model.SchemaModule;

import java.util.List;

/**
 * Service provider contributing resolved modules to the {@link ModuleRegistry}.
 * Implementations are discovered through {@link java.util.ServiceLoader} and
 * are listed in {@code META-INF/services/com.netconf.yangprinter.registry.ModuleProvider}.
 */
public interface ModuleProvider {

    /**
     * @return fully resolved modules; every cross-module reference points to a module object that is already built
     */
    List<SchemaModule> getModules();
}
