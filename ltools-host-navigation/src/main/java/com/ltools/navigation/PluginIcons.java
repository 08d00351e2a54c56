package com.ltools.navigation;

import java.util.Map;

/**
 * Static plugin id to icon key table used for menu items.
 */
public final class PluginIcons {

    public static final String DEFAULT_ICON = "puzzle-piece";

    private static final Map<String, String> ICONS = Map.ofEntries(
            Map.entry("calculator.builtin", "calculator"),
            Map.entry("clipboard.builtin", "clipboard"),
            Map.entry("jsoneditor.builtin", "code"),
            Map.entry("processmanager.builtin", "process"),
            Map.entry("sysinfo.builtin", "cpu"),
            Map.entry("qrcode.builtin", "qrcode"),
            Map.entry("hosts.builtin", "server"),
            Map.entry("tunnel.builtin", "network"),
            Map.entry("datetime.builtin", "clock"),
            Map.entry("screenshot2.builtin", "camera"),
            Map.entry("password.builtin", "key"),
            Map.entry("kanban.builtin", "view-columns"));

    private PluginIcons() {
    }

    public static String iconFor(String pluginId) {
        return pluginId != null ? ICONS.getOrDefault(pluginId, DEFAULT_ICON) : DEFAULT_ICON;
    }
}
