package com.ltools.navigation;

public enum HookPhase {
    ENTER,
    LEAVE
}
