package com.ltools.events;

/**
 * Kind of a {@link LifecycleEvent}.
 */
public enum LifecycleEventKind {
    REGISTERED,
    ENABLED,
    DISABLED,
    ENTER_HANDLED,
    LEAVE_HANDLED,
    ERROR;

    /** True for kinds that change what the navigation menu shows. */
    public boolean affectsNavigation() {
        return this == REGISTERED || this == ENABLED || this == DISABLED || this == ERROR;
    }
}
