package com.ltools.shortcuts;

import java.util.Optional;

/**
 * What {@link ShortcutDispatcher} did with a trigger.
 */
public final class DispatchOutcome {

    public enum Kind {
        /** Reserved action handler ran. */
        ACTION_INVOKED,
        /** No handler for the reserved action. */
        ACTION_UNHANDLED,
        /** Reserved action handler threw. */
        ACTION_FAILED,
        NAVIGATED,
        /** Navigation was attempted; the page does not exist. */
        NO_SUCH_PAGE,
        /** Key combo not bound. */
        UNBOUND
    }

    private final Kind kind;
    private final String pluginId;
    private final ReservedAction action;
    private final String path;
    private final Throwable error;

    private DispatchOutcome(Kind kind, String pluginId, ReservedAction action, String path, Throwable error) {
        this.kind = kind;
        this.pluginId = pluginId;
        this.action = action;
        this.path = path;
        this.error = error;
    }

    static DispatchOutcome action(Kind kind, ReservedAction action, Throwable error) {
        return new DispatchOutcome(kind, action.pluginId(), action, null, error);
    }

    static DispatchOutcome navigation(Kind kind, String pluginId, String path) {
        return new DispatchOutcome(kind, pluginId, null, path, null);
    }

    static DispatchOutcome unbound(String keyCombo) {
        return new DispatchOutcome(Kind.UNBOUND, null, null, keyCombo, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getPluginId() {
        return pluginId;
    }

    public Optional<ReservedAction> getAction() {
        return Optional.ofNullable(action);
    }

    /** Navigation path attempted (or the unbound combo for {@link Kind#UNBOUND}). */
    public String getPath() {
        return path;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "DispatchOutcome{" + kind + ", pluginId=" + pluginId
                + (action != null ? ", action=" + action : "") + (path != null ? ", path=" + path : "") + "}";
    }
}
