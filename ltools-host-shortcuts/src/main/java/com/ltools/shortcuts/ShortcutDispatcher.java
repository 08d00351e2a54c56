package com.ltools.shortcuts;

import com.ltools.events.EventBus;
import com.ltools.events.HostTopics;
import com.ltools.events.Subscription;
import com.ltools.navigation.NavigationOutcome;
import com.ltools.navigation.NavigationSynchronizer;
import com.ltools.navigation.Navigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes a triggered shortcut. Reserved plugin ids run the matching {@link ReservedActionHandler};
 * every other id navigates to {@code /plugins/<id>}. Nothing here throws for bad input or failing
 * handlers: the result is reported as a {@link DispatchOutcome} and logged.
 */
public final class ShortcutDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShortcutDispatcher.class);

    private final Navigator navigator;
    private final ShortcutTable table;
    private final Map<ReservedAction, ReservedActionHandler> handlers = new EnumMap<>(ReservedAction.class);
    private volatile Subscription<String> subscription;

    public ShortcutDispatcher(Navigator navigator, ShortcutTable table) {
        this.navigator = Objects.requireNonNull(navigator, "navigator");
        this.table = table != null ? table : ShortcutTable.empty();
    }

    /** Sets the handler for a reserved action, replacing any previous one. */
    public synchronized void registerHandler(ReservedAction action, ReservedActionHandler handler) {
        handlers.put(Objects.requireNonNull(action, "action"), Objects.requireNonNull(handler, "handler"));
    }

    public ShortcutTable table() {
        return table;
    }

    /** Dispatches a plugin id emitted by the input layer. */
    public DispatchOutcome handle(String pluginId) {
        Optional<ReservedAction> reserved = ReservedAction.forPluginId(pluginId);
        if (reserved.isPresent()) {
            return runAction(reserved.get());
        }
        String id = pluginId != null ? pluginId.trim() : "";
        if (id.isEmpty()) {
            log.warn("Shortcut triggered without a plugin id; opening the plugin list");
        }
        String path = NavigationSynchronizer.pluginPath(id);
        NavigationOutcome outcome = navigator.navigate(path);
        if (outcome == NavigationOutcome.NO_SUCH_PAGE) {
            log.warn("Shortcut for {}: no such page {}", id, path);
            return DispatchOutcome.navigation(DispatchOutcome.Kind.NO_SUCH_PAGE, id, path);
        }
        log.debug("Shortcut for {} navigated to {}", id, path);
        return DispatchOutcome.navigation(DispatchOutcome.Kind.NAVIGATED, id, path);
    }

    /** Resolves a key combo through the binding table, then dispatches. */
    public DispatchOutcome handleKeyCombo(String keyCombo) {
        Optional<String> pluginId = table.lookup(keyCombo);
        if (pluginId.isEmpty()) {
            log.debug("No shortcut bound to {}", keyCombo);
            return DispatchOutcome.unbound(keyCombo);
        }
        return handle(pluginId.get());
    }

    /** Listens for plugin ids on {@link HostTopics#SHORTCUT_TRIGGERED}. */
    public void start(EventBus events) {
        if (subscription != null) return;
        subscription = events.subscribe(HostTopics.SHORTCUT_TRIGGERED, this::handle);
    }

    private DispatchOutcome runAction(ReservedAction action) {
        ReservedActionHandler handler;
        synchronized (this) {
            handler = handlers.get(action);
        }
        if (handler == null) {
            log.warn("No handler for reserved action {}", action);
            return DispatchOutcome.action(DispatchOutcome.Kind.ACTION_UNHANDLED, action, null);
        }
        try {
            handler.handle(action);
            log.debug("Reserved action {} handled", action);
            return DispatchOutcome.action(DispatchOutcome.Kind.ACTION_INVOKED, action, null);
        } catch (Exception e) {
            log.warn("Reserved action {} failed: {}", action, e.getMessage(), e);
            return DispatchOutcome.action(DispatchOutcome.Kind.ACTION_FAILED, action, e);
        }
    }

    @Override
    public void close() {
        Subscription<String> s = subscription;
        if (s != null) {
            s.close();
            subscription = null;
        }
    }
}
