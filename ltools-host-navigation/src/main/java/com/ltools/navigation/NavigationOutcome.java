package com.ltools.navigation;

/** Result of a {@link Navigator#navigate} request. */
public enum NavigationOutcome {
    NAVIGATED,
    /** Already on that page. */
    UNCHANGED,
    NO_SUCH_PAGE
}
