package com.ltools.navigation;

/**
 * Routing surface used by shortcut dispatch and the UI.
 */
public interface Navigator {

    /** Requests a route change. Never throws for unknown paths; answers {@link NavigationOutcome#NO_SUCH_PAGE}. */
    NavigationOutcome navigate(String path);

    /** Current route. */
    String currentPath();
}
