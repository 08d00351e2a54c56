package com.ltools.plugin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginManagerTest {

    @Test
    void builtinProvidersComeFirst() {
        PluginManager manager = new PluginManager();
        manager.registerBuiltin(new PluginProvider() {
            @Override
            public String getPluginId() {
                return "a.builtin";
            }

            @Override
            public PluginCapability createCapability() {
                return TestCapability.of("a.builtin");
            }
        });
        manager.registerBuiltin(null);

        assertEquals(1, manager.getBuiltinCount());
        assertEquals("a.builtin", manager.getProviders().get(0).getPluginId());
    }

    @Test
    void loadExternal_missingDirectoryIsIgnored(@TempDir Path dir) {
        PluginManager manager = new PluginManager();
        manager.loadExternalPlugins(dir.resolve("absent"));
        manager.loadExternalPlugins(null);
        assertEquals(0, manager.getExternalCount());
    }

    @Test
    void loadExternal_corruptJarIsSkipped(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("broken.jar"), "not a jar");
        PluginManager manager = new PluginManager();

        manager.loadExternalPlugins(dir);

        assertEquals(0, manager.getExternalCount());
        manager.close();
    }

    @Test
    void restrictedLoader_exposesOnlyPluginApi() throws Exception {
        RestrictedPluginClassLoader loader = new RestrictedPluginClassLoader();

        assertTrue(RestrictedPluginClassLoader.isAllowed("com.ltools.plugin.PluginCapability"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.ltools.lifecycle.LifecycleManager"));
        assertTrue(RestrictedPluginClassLoader.isAllowed("com.ltools.plugin.PluginProvider"));
        assertTrue(RestrictedPluginClassLoader.isAllowed("com.ltools.events.Topic"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.ltools.plugin.datetime.DateTimePlugin"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.ltools.plugin.processmanager.ProcessManagerPlugin"));
        assertThrows(ClassNotFoundException.class,
                () -> loader.loadClass("com.ltools.plugin.datetime.DateTimePlugin"));
        assertEquals(PluginCapability.class, loader.loadClass("com.ltools.plugin.PluginCapability"));
        assertThrows(ClassNotFoundException.class, () -> loader.loadClass("com.fasterxml.jackson.databind.ObjectMapper"));
    }
}
