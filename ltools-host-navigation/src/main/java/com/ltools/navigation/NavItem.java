package com.ltools.navigation;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the navigation menu.
 *
 * @param id       item id ({@code home}, {@code plugins}, {@code settings} or {@code plugin-<pluginId>})
 * @param label    display label
 * @param icon     icon key
 * @param path     route path
 * @param pluginId plugin id for plugin items; null for base items
 */
public record NavItem(String id, String label, String icon, String path, String pluginId) {

    public NavItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
    }

    static NavItem base(String id, String label, String icon, String path) {
        return new NavItem(id, label, icon, path, null);
    }

    public Optional<String> plugin() {
        return Optional.ofNullable(pluginId);
    }
}
