package com.ltools.plugin;

/**
 * Parent class loader for external plugin JARs. Exposes only the JDK, the plugin API
 * ({@code com.ltools.plugin}, {@code com.ltools.events}, {@code com.ltools.annotations}) and
 * SLF4J; any other class, including host internals such as the lifecycle manager or navigation,
 * fails with {@link ClassNotFoundException}. The plugin API packages are matched exactly, so
 * built-in plugin implementations under {@code com.ltools.plugin.*} stay hidden. {@code Class.forName} goes through the same check.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "jdk.",
            "org.slf4j."
    };

    // subpackages excluded
    private static final String[] ALLOWED_PACKAGES = {
            "com.ltools.plugin.",
            "com.ltools.events.",
            "com.ltools.annotations."
    };

    private final ClassLoader hostLoader;

    public RestrictedPluginClassLoader() {
        super(null);
        this.hostLoader = PluginProvider.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c != null) {
                if (resolve) resolveClass(c);
                return c;
            }
            if (isAllowed(name)) {
                c = hostLoader.loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }
            throw new ClassNotFoundException("Access denied: " + name
                    + " (external plugins may only use the JDK, com.ltools.plugin, com.ltools.events, com.ltools.annotations and org.slf4j)");
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        for (String pkg : ALLOWED_PACKAGES) {
            if (name.startsWith(pkg) && name.indexOf('.', pkg.length()) < 0) return true;
        }
        return false;
    }
}
