package com.ltools.events;

/**
 * Topics shared by the host core. Plugins define their own topics for their payloads.
 */
public final class HostTopics {

    /** Registry mutations and page hook completions. */
    public static final Topic<LifecycleEvent> LIFECYCLE = Topic.of("plugin:lifecycle", LifecycleEvent.class);

    /** Plugin ids emitted by the global input layer when a bound key combination fires. */
    public static final Topic<String> SHORTCUT_TRIGGERED = Topic.of("shortcut:triggered", String.class);

    private HostTopics() {
    }
}
