package com.ltools.navigation;

import java.util.concurrent.CompletableFuture;

/**
 * Handle returned by {@link PageGuard#notifyTransition}. Hooks complete asynchronously; the
 * futures are the only way to observe them besides the ENTER_HANDLED/LEAVE_HANDLED events.
 * The futures never complete exceptionally.
 */
public final class PageTransition {

    private final String previousPluginId;
    private final String nextPluginId;
    private final CompletableFuture<HookOutcome> leave;
    private final CompletableFuture<HookOutcome> enter;

    PageTransition(String previousPluginId, String nextPluginId,
                   CompletableFuture<HookOutcome> leave, CompletableFuture<HookOutcome> enter) {
        this.previousPluginId = previousPluginId;
        this.nextPluginId = nextPluginId;
        this.leave = leave;
        this.enter = enter;
    }

    static PageTransition unchanged(String pluginId) {
        return new PageTransition(pluginId, pluginId,
                CompletableFuture.completedFuture(HookOutcome.skipped(pluginId, HookPhase.LEAVE)),
                CompletableFuture.completedFuture(HookOutcome.skipped(pluginId, HookPhase.ENTER)));
    }

    public String getPreviousPluginId() {
        return previousPluginId;
    }

    public String getNextPluginId() {
        return nextPluginId;
    }

    public CompletableFuture<HookOutcome> leave() {
        return leave;
    }

    public CompletableFuture<HookOutcome> enter() {
        return enter;
    }

    /** True if this transition changed the current page. */
    public boolean isChange() {
        return previousPluginId == null ? nextPluginId != null : !previousPluginId.equals(nextPluginId);
    }

    /** Completes when both hooks have completed. */
    public CompletableFuture<Void> completion() {
        return CompletableFuture.allOf(leave, enter);
    }
}
