package com.netconf.yangprinter.registry;

import com.netconf.yangprinter.model.SchemaModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Modules available for printing, indexed by module name.
 */
public class ModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final Map<String, SchemaModule> modulesByName = new LinkedHashMap<>();

    public ModuleRegistry(Iterable<? extends ModuleProvider> providers) {
        for (ModuleProvider provider : providers) {
            for (SchemaModule module : provider.getModules()) {
                register(provider, module);
            }
        }
        log.debug("Registered {} modules", modulesByName.size());
    }

    /**
     * Registry over all providers visible to the current class loader.
     */
    public static ModuleRegistry load() {
        return new ModuleRegistry(ServiceLoader.load(ModuleProvider.class));
    }

    public Optional<SchemaModule> find(String moduleName) {
        return Optional.ofNullable(modulesByName.get(moduleName));
    }

    /**
     * Module names in registration order.
     */
    public List<String> getModuleNames() {
        return new ArrayList<>(modulesByName.keySet());
    }

    public List<SchemaModule> getModules() {
        return new ArrayList<>(modulesByName.values());
    }

    public boolean isEmpty() {
        return modulesByName.isEmpty();
    }

    private void register(ModuleProvider provider, SchemaModule module) {
        SchemaModule existing = modulesByName.putIfAbsent(module.getName(), module);
        if (existing != null && existing != module) {
            log.warn("Ignoring duplicate module {} from {}", module.getName(), provider.getClass().getName());
        }
    }
}
