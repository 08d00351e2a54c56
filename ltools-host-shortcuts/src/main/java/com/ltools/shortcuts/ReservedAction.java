package com.ltools.shortcuts;

import com.ltools.config.ShortcutBinding;

import java.util.Optional;

/**
 * Plugin ids that trigger a host action instead of navigating to a page.
 */
public enum ReservedAction {
    SEARCH_WINDOW_TOGGLE(ShortcutBinding.SEARCH_WINDOW_ID),
    SCREENSHOT_CAPTURE(ShortcutBinding.SCREENSHOT_ID);

    private final String pluginId;

    ReservedAction(String pluginId) {
        this.pluginId = pluginId;
    }

    public String pluginId() {
        return pluginId;
    }

    public static Optional<ReservedAction> forPluginId(String pluginId) {
        if (pluginId == null) return Optional.empty();
        String id = pluginId.trim();
        for (ReservedAction a : values()) {
            if (a.pluginId.equals(id)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
