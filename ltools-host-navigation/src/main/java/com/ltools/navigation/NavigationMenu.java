package com.ltools.navigation;

import java.util.List;

/**
 * Ordered menu published on {@link NavigationSynchronizer#ITEMS}.
 *
 * @param items base items followed by plugin items in registration order
 */
public record NavigationMenu(List<NavItem> items) {

    public NavigationMenu {
        items = items != null ? List.copyOf(items) : List.of();
    }
}
