package com.ltools.host;

import com.ltools.bootstrap.HostBootstrap;
import com.ltools.bootstrap.HostContext;
import com.ltools.events.HostTopics;
import com.ltools.navigation.NavItem;
import com.ltools.navigation.NavigationSynchronizer;
import com.ltools.shortcuts.DispatchOutcome;
import com.ltools.shortcuts.ReservedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * LTools host entry point. Configuration comes from {@code LTOOLS_*} environment variables.
 * <p>
 * Without a UI attached, the host reads shortcut input from stdin: a line containing {@code +} is
 * treated as a key combo, anything else as a plugin id. When stdin is closed the main thread
 * blocks until the JVM is stopped; the shutdown hook closes the host.
 */
public final class LtoolsHostApplication {

    private static final Logger log = LoggerFactory.getLogger(LtoolsHostApplication.class);

    private LtoolsHostApplication() {
    }

    public static void main(String[] args) {
        HostContext host = HostBootstrap.initialize();

        for (ReservedAction action : ReservedAction.values()) {
            host.registerReservedHandler(action, a -> log.info("Reserved action {} requested; no window layer attached", a));
        }
        host.events().subscribe(HostTopics.LIFECYCLE, e -> log.info("Plugin {} {} {}", e.pluginId(), e.kind(), e.detail()));
        host.events().subscribe(NavigationSynchronizer.ITEMS, menu -> log.info("Navigation: {}",
                menu.items().stream().map(NavItem::label).collect(Collectors.joining(", "))));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down host...");
            host.close();
        }));

        log.info("Host started | plugins: {} | menu: {}", host.plugins().size(), host.navigationItems().size());
        readShortcuts(host);

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down host...");
            host.close();
        }
    }

    private static void readShortcuts(HostContext host) {
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                String input = line.trim();
                if (input.isEmpty()) continue;
                DispatchOutcome outcome = input.contains("+")
                        ? host.dispatchKeyCombo(input)
                        : host.dispatchShortcut(input);
                log.info("{} -> {}", input, outcome);
            }
        } catch (IOException e) {
            log.warn("Shortcut input closed: {}", e.getMessage());
        }
    }
}
