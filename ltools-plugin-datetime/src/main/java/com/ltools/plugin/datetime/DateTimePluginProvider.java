package com.ltools.plugin.datetime;

import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginProvider;

import java.time.Clock;
import java.time.Duration;

/** Builtin provider for {@link DateTimePlugin}. */
public final class DateTimePluginProvider implements PluginProvider {

    private final Duration tick;

    public DateTimePluginProvider(Duration tick) {
        this.tick = tick;
    }

    @Override
    public String getPluginId() {
        return DateTimePlugin.ID;
    }

    @Override
    public PluginCapability createCapability() {
        return new DateTimePlugin(Clock.systemDefaultZone(), tick);
    }
}
