package com.ltools.lifecycle;

import com.ltools.events.EventBus;
import com.ltools.events.Topic;
import com.ltools.plugin.PeriodicTaskHandle;
import com.ltools.plugin.PluginContext;

import java.time.Duration;

/** Context bound to one plugin id. */
final class HostPluginContext implements PluginContext {

    private final String pluginId;
    private final EventBus events;
    private final LifecycleManager lifecycle;

    HostPluginContext(String pluginId, EventBus events, LifecycleManager lifecycle) {
        this.pluginId = pluginId;
        this.events = events;
        this.lifecycle = lifecycle;
    }

    @Override
    public String pluginId() {
        return pluginId;
    }

    @Override
    public <T> int publish(Topic<T> topic, T payload) {
        return events.publish(topic, payload);
    }

    @Override
    public PeriodicTaskHandle schedulePeriodic(String name, Duration period, Runnable task) {
        return lifecycle.schedulePeriodic(pluginId, name, period, task);
    }
}
