package com.ltools.lifecycle;

import com.ltools.annotations.ResourceCleanup;
import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginContext;
import com.ltools.plugin.PluginMetadata;
import com.ltools.plugin.PluginType;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Capability fake counting hook calls; hooks can be made to block or fail. */
class CountingCapability implements PluginCapability, ResourceCleanup {

    final AtomicInteger inits = new AtomicInteger();
    final AtomicInteger startups = new AtomicInteger();
    final AtomicInteger shutdowns = new AtomicInteger();
    final AtomicInteger exits = new AtomicInteger();
    volatile CountDownLatch startupGate;
    final CountDownLatch startupEntered = new CountDownLatch(1);
    volatile RuntimeException initFailure;
    volatile RuntimeException startupFailure;
    volatile RuntimeException shutdownFailure;

    private final PluginMetadata metadata;

    CountingCapability(String id) {
        this.metadata = PluginMetadata.builder(id).type(PluginType.BUILTIN).build();
    }

    @Override
    public PluginMetadata metadata() {
        return metadata;
    }

    @Override
    public void init(PluginContext context) {
        inits.incrementAndGet();
        if (initFailure != null) throw initFailure;
    }

    @Override
    public void startup(PluginContext context) throws Exception {
        startups.incrementAndGet();
        startupEntered.countDown();
        CountDownLatch gate = startupGate;
        if (gate != null && !gate.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("gate not released");
        }
        onStartup(context);
        if (startupFailure != null) throw startupFailure;
    }

    void onStartup(PluginContext context) {
    }

    @Override
    public void shutdown() {
        shutdowns.incrementAndGet();
        if (shutdownFailure != null) throw shutdownFailure;
    }

    @Override
    public void onExit() {
        exits.incrementAndGet();
    }
}
