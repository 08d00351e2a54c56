package com.ltools.navigation;

import com.ltools.plugin.PluginRecord;
import com.ltools.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Host-side {@link Navigator}. Knows the base pages and {@code /plugins/<id>} for every registered
 * plugin that has a page. Each route change is reported to the {@link PageGuard}.
 */
public final class HostRouter implements Navigator {

    private static final Logger log = LoggerFactory.getLogger(HostRouter.class);

    private static final Set<String> BASE_PATHS = Set.of(
            NavigationSynchronizer.HOME_PATH, NavigationSynchronizer.PLUGINS_PATH, NavigationSynchronizer.SETTINGS_PATH);

    private final PluginRegistry registry;
    private final PageGuard guard;
    private final Object routeLock = new Object();
    private String currentPath = NavigationSynchronizer.HOME_PATH;

    public HostRouter(PluginRegistry registry, PageGuard guard) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    @Override
    public NavigationOutcome navigate(String path) {
        String target = normalize(path);
        if (target == null) {
            log.warn("No such page: {}", path);
            return NavigationOutcome.NO_SUCH_PAGE;
        }
        String previousPluginId;
        synchronized (routeLock) {
            if (target.equals(currentPath)) {
                return NavigationOutcome.UNCHANGED;
            }
            previousPluginId = pluginIdOf(currentPath).orElse(null);
            currentPath = target;
            // notify under the lock so leave/enter submissions follow route order
            guard.notifyTransition(previousPluginId, pluginIdOf(target).orElse(null));
        }
        log.debug("Navigated to {}", target);
        return NavigationOutcome.NAVIGATED;
    }

    @Override
    public String currentPath() {
        synchronized (routeLock) {
            return currentPath;
        }
    }

    /** Plugin id addressed by a {@code /plugins/<id>} path. */
    public static Optional<String> pluginIdOf(String path) {
        String prefix = NavigationSynchronizer.PLUGINS_PATH + "/";
        if (path == null || !path.startsWith(prefix)) return Optional.empty();
        String id = path.substring(prefix.length()).trim();
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }

    /** Canonical form of a known route, or null if there is no such page. */
    private String normalize(String path) {
        if (path == null || path.isBlank()) return null;
        String p = path.trim();
        if (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (BASE_PATHS.contains(p)) return p;
        Optional<String> id = pluginIdOf(p);
        if (id.isEmpty()) return null;
        Optional<PluginRecord> record = registry.get(id.get());
        if (record.isEmpty() || !record.get().getRuntimeState().hasPage()) return null;
        return NavigationSynchronizer.pluginPath(record.get().getId());
    }
}
