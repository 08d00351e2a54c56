package com.ltools.plugin;

import java.util.Objects;

/**
 * Mutable-in-time part of a plugin entry. Instances are immutable; the registry swaps the whole
 * value, so readers never see a half-updated state.
 *
 * @param state      enablement state
 * @param hasPage    whether the plugin has a page
 * @param showInMenu whether the page is listed in the menu
 * @param detail     last failure message; null unless {@link PluginState#ERROR}
 */
public record PluginRuntimeState(PluginState state, boolean hasPage, boolean showInMenu, String detail) {

    public PluginRuntimeState {
        Objects.requireNonNull(state, "state");
        if (state != PluginState.ERROR) {
            detail = null;
        }
    }

    /** Initial state for freshly registered metadata. */
    public static PluginRuntimeState installed(PluginMetadata metadata) {
        return new PluginRuntimeState(PluginState.INSTALLED, metadata.hasPage(), metadata.showInMenu(), null);
    }

    /** Same flags, new state. */
    public PluginRuntimeState withState(PluginState newState, String newDetail) {
        return new PluginRuntimeState(newState, hasPage, showInMenu, newDetail);
    }

    /** True when a plugin in this state contributes a menu item. */
    public boolean isNavigable() {
        return state == PluginState.ENABLED && hasPage && showInMenu;
    }
}
