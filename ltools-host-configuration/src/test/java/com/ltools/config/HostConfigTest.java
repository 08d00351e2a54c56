package com.ltools.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HostConfigTest {

    @Test
    void builder_derivesFilesFromDataDir() {
        Path dataDir = Path.of("/tmp/ltools-test");
        HostConfig config = HostConfig.builder().dataDir(dataDir).platform("Linux").build();

        assertEquals(dataDir.resolve("shortcuts.json"), config.getShortcutsFile());
        assertEquals(dataDir.resolve("plugins"), config.getPluginsDir());
        assertEquals(HostConfig.PLATFORM_LINUX, config.getPlatform());
        assertEquals("CONCURRENT", config.getHookOrdering());
        assertEquals(1000L, config.getClockTickMillis());
    }

    @Test
    void builder_clampsPoolSizesAndNormalizesOrdering() {
        HostConfig config = HostConfig.builder()
                .schedulerThreads(0)
                .hookThreads(-3)
                .hookOrdering(" sequential ")
                .disabledPlugins(Set.of("datetime.builtin"))
                .build();

        assertEquals(1, config.getSchedulerThreads());
        assertEquals(1, config.getHookThreads());
        assertEquals("SEQUENTIAL", config.getHookOrdering());
        assertTrue(config.getDisabledPlugins().contains("datetime.builtin"));
    }

    @Test
    void detectPlatform_mapsOsNames() {
        assertEquals(HostConfig.PLATFORM_DARWIN, HostConfig.detectPlatform("Mac OS X"));
        assertEquals(HostConfig.PLATFORM_WINDOWS, HostConfig.detectPlatform("Windows 11"));
        assertEquals(HostConfig.PLATFORM_LINUX, HostConfig.detectPlatform("Linux"));
        assertEquals(HostConfig.PLATFORM_LINUX, HostConfig.detectPlatform(null));
    }
}
