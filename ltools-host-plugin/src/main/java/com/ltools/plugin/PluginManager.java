package com.ltools.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Holds builtin providers (on the host classpath) and external providers loaded from
 * {@code *.jar} files in the plugins directory. Only that directory is scanned. Each JAR gets
 * its own class loader whose parent is a {@link RestrictedPluginClassLoader}.
 * <p>
 * External load failures are logged and skipped; the host keeps running.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final List<PluginProvider> builtinProviders = new ArrayList<>();
    private final List<PluginProvider> externalProviders = new ArrayList<>();
    private final List<URLClassLoader> externalLoaders = new ArrayList<>();

    /** Registers a builtin provider. */
    public void registerBuiltin(PluginProvider provider) {
        if (provider != null) {
            builtinProviders.add(provider);
        }
    }

    /**
     * Loads external providers from the given directory. A missing directory is not an error.
     *
     * @param pluginsDir directory containing plugin JARs; null is ignored
     */
    public void loadExternalPlugins(Path pluginsDir) {
        if (pluginsDir == null) {
            return;
        }
        if (!Files.exists(pluginsDir)) {
            log.debug("External plugins directory does not exist: {}", pluginsDir);
            return;
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("External plugins path is not a directory: {}", pluginsDir);
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                loadExternalJar(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list external plugins directory {}: {}", pluginsDir, e.getMessage());
        }
    }

    private void loadExternalJar(Path jar) {
        try {
            URL jarUrl = jar.toUri().toURL();
            URLClassLoader loader = new URLClassLoader(new URL[]{jarUrl}, new RestrictedPluginClassLoader());
            externalLoaders.add(loader);

            int n = 0;
            for (ServiceLoader.Provider<PluginProvider> p : ServiceLoader.load(PluginProvider.class, loader).stream().toList()) {
                try {
                    externalProviders.add(p.get());
                    n++;
                } catch (Exception | ServiceConfigurationError e) {
                    log.error("External provider {} from {} failed to instantiate (skipping): {}",
                            p.type().getName(), jar.getFileName(), e.getMessage(), e);
                }
            }
            if (n > 0) {
                log.info("Loaded {} provider(s) from external JAR: {}", n, jar.getFileName());
            }
        } catch (Exception | ServiceConfigurationError e) {
            log.error("Failed to load external plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
        }
    }

    public List<PluginProvider> getBuiltinProviders() {
        return new ArrayList<>(builtinProviders);
    }

    public List<PluginProvider> getExternalProviders() {
        return new ArrayList<>(externalProviders);
    }

    /** Builtin first, then external. */
    public List<PluginProvider> getProviders() {
        List<PluginProvider> out = new ArrayList<>(builtinProviders.size() + externalProviders.size());
        out.addAll(builtinProviders);
        out.addAll(externalProviders);
        return out;
    }

    public int getBuiltinCount() {
        return builtinProviders.size();
    }

    public int getExternalCount() {
        return externalProviders.size();
    }

    /** Closes the class loaders of external JARs. Call after every external plugin has shut down. */
    public void close() {
        for (URLClassLoader loader : externalLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close plugin class loader: {}", e.getMessage());
            }
        }
        externalLoaders.clear();
    }
}
