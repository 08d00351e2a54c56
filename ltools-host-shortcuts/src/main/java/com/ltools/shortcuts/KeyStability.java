package com.ltools.shortcuts;

/** How reliably a key combination can be registered as a global shortcut. */
public enum KeyStability {
    STABLE,
    MOSTLY_STABLE,
    UNSTABLE,
    SYSTEM_RESERVED
}
