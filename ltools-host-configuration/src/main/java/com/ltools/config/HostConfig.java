package com.ltools.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the LTools host.
 * <p>
 * Data directory: LTOOLS_DATA_DIR (default {@code ~/.ltools}). Shortcut bindings and external plugin
 * JARs default to files under it. Pool sizes: LTOOLS_SCHEDULER_THREADS, LTOOLS_HOOK_THREADS.
 */
public final class HostConfig {

    private static final String ENV_DATA_DIR = "LTOOLS_DATA_DIR";
    private static final String ENV_SHORTCUTS_FILE = "LTOOLS_SHORTCUTS_FILE";
    private static final String ENV_PLUGINS_DIR = "LTOOLS_PLUGINS_DIR";
    private static final String ENV_DISABLED_PLUGINS = "LTOOLS_DISABLED_PLUGINS";
    private static final String ENV_SCHEDULER_THREADS = "LTOOLS_SCHEDULER_THREADS";
    private static final String ENV_HOOK_THREADS = "LTOOLS_HOOK_THREADS";
    private static final String ENV_HOOK_ORDERING = "LTOOLS_HOOK_ORDERING";
    private static final String ENV_PLATFORM = "LTOOLS_PLATFORM";
    private static final String ENV_CLOCK_TICK_MILLIS = "LTOOLS_CLOCK_TICK_MILLIS";

    public static final String PLATFORM_DARWIN = "darwin";
    public static final String PLATFORM_WINDOWS = "windows";
    public static final String PLATFORM_LINUX = "linux";

    private static final String DEFAULT_DATA_DIR_NAME = ".ltools";
    private static final String SHORTCUTS_FILE_NAME = "shortcuts.json";
    private static final String PLUGINS_DIR_NAME = "plugins";
    private static final int DEFAULT_SCHEDULER_THREADS = 2;
    private static final int DEFAULT_HOOK_THREADS = 2;
    private static final String DEFAULT_HOOK_ORDERING = "CONCURRENT";
    private static final long DEFAULT_CLOCK_TICK_MILLIS = 1000L;

    private final Path dataDir;
    private final Path shortcutsFile;
    private final Path pluginsDir;
    private final Set<String> disabledPlugins;
    private final int schedulerThreads;
    private final int hookThreads;
    private final String hookOrdering;
    private final String platform;
    private final long clockTickMillis;

    private HostConfig(Builder b) {
        this.dataDir = b.dataDir != null ? b.dataDir : defaultDataDir();
        this.shortcutsFile = b.shortcutsFile != null ? b.shortcutsFile : dataDir.resolve(SHORTCUTS_FILE_NAME);
        this.pluginsDir = b.pluginsDir != null ? b.pluginsDir : dataDir.resolve(PLUGINS_DIR_NAME);
        this.disabledPlugins = Collections.unmodifiableSet(new LinkedHashSet<>(b.disabledPlugins));
        this.schedulerThreads = Math.max(1, b.schedulerThreads);
        this.hookThreads = Math.max(1, b.hookThreads);
        this.hookOrdering = b.hookOrdering != null && !b.hookOrdering.isBlank()
                ? b.hookOrdering.trim().toUpperCase(Locale.ROOT) : DEFAULT_HOOK_ORDERING;
        this.platform = b.platform != null && !b.platform.isBlank()
                ? b.platform.trim().toLowerCase(Locale.ROOT) : detectPlatform(System.getProperty("os.name"));
        this.clockTickMillis = b.clockTickMillis > 0 ? b.clockTickMillis : DEFAULT_CLOCK_TICK_MILLIS;
    }

    /** Data directory holding shortcut bindings and external plugins. */
    public Path getDataDir() {
        return dataDir;
    }

    /** JSON file with the static shortcut bindings. Default {@code <dataDir>/shortcuts.json}. */
    public Path getShortcutsFile() {
        return shortcutsFile;
    }

    /** Directory scanned for external plugin JARs. Default {@code <dataDir>/plugins}. */
    public Path getPluginsDir() {
        return pluginsDir;
    }

    /** Plugin ids left disabled when the host starts all plugins (LTOOLS_DISABLED_PLUGINS). */
    public Set<String> getDisabledPlugins() {
        return disabledPlugins;
    }

    /** Threads for periodic plugin tasks. Default 2. */
    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    /** Threads for page enter/leave hooks. Default 2. */
    public int getHookThreads() {
        return hookThreads;
    }

    /** Page hook ordering mode, upper case ({@code CONCURRENT} or {@code SEQUENTIAL}). Default CONCURRENT. */
    public String getHookOrdering() {
        return hookOrdering;
    }

    /** Platform id used for key combination defaults and validation: darwin, windows or linux. */
    public String getPlatform() {
        return platform;
    }

    public boolean isDarwin() {
        return PLATFORM_DARWIN.equals(platform);
    }

    /** Tick of the builtin clock plugin in milliseconds. Default 1000. */
    public long getClockTickMillis() {
        return clockTickMillis;
    }

    public static HostConfig fromEnvironment() {
        Builder b = builder()
                .disabledPlugins(parseCommaSeparated(System.getenv(ENV_DISABLED_PLUGINS)))
                .schedulerThreads(parseInt(System.getenv(ENV_SCHEDULER_THREADS), DEFAULT_SCHEDULER_THREADS))
                .hookThreads(parseInt(System.getenv(ENV_HOOK_THREADS), DEFAULT_HOOK_THREADS))
                .hookOrdering(getEnv(ENV_HOOK_ORDERING, DEFAULT_HOOK_ORDERING))
                .platform(getEnv(ENV_PLATFORM, null))
                .clockTickMillis(parseLong(System.getenv(ENV_CLOCK_TICK_MILLIS), DEFAULT_CLOCK_TICK_MILLIS));
        String dataDir = getEnv(ENV_DATA_DIR, null);
        if (dataDir != null) b.dataDir(Paths.get(dataDir));
        String shortcuts = getEnv(ENV_SHORTCUTS_FILE, null);
        if (shortcuts != null) b.shortcutsFile(Paths.get(shortcuts));
        String pluginsDir = getEnv(ENV_PLUGINS_DIR, null);
        if (pluginsDir != null) b.pluginsDir(Paths.get(pluginsDir));
        return b.build();
    }

    /**
     * Maps a JVM {@code os.name} value to darwin, windows or linux. Unknown systems are treated as linux.
     */
    public static String detectPlatform(String osName) {
        String os = osName != null ? osName.toLowerCase(Locale.ROOT) : "";
        if (os.contains("mac") || os.contains("darwin")) return PLATFORM_DARWIN;
        if (os.contains("win")) return PLATFORM_WINDOWS;
        return PLATFORM_LINUX;
    }

    private static Path defaultDataDir() {
        return Paths.get(System.getProperty("user.home", "."), DEFAULT_DATA_DIR_NAME);
    }

    private static Set<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return v != null && !v.isBlank() ? v.trim() : defaultValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path dataDir;
        private Path shortcutsFile;
        private Path pluginsDir;
        private Set<String> disabledPlugins = Set.of();
        private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
        private int hookThreads = DEFAULT_HOOK_THREADS;
        private String hookOrdering = DEFAULT_HOOK_ORDERING;
        private String platform;
        private long clockTickMillis = DEFAULT_CLOCK_TICK_MILLIS;

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder shortcutsFile(Path shortcutsFile) {
            this.shortcutsFile = shortcutsFile;
            return this;
        }

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public Builder disabledPlugins(Set<String> disabledPlugins) {
            this.disabledPlugins = disabledPlugins != null ? disabledPlugins : Set.of();
            return this;
        }

        public Builder schedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
            return this;
        }

        public Builder hookThreads(int hookThreads) {
            this.hookThreads = hookThreads;
            return this;
        }

        public Builder hookOrdering(String hookOrdering) {
            this.hookOrdering = hookOrdering;
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder clockTickMillis(long clockTickMillis) {
            this.clockTickMillis = clockTickMillis;
            return this;
        }

        public HostConfig build() {
            return new HostConfig(this);
        }
    }
}
