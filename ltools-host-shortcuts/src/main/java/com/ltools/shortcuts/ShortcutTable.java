package com.ltools.shortcuts;

import com.ltools.config.ShortcutBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only lookup of normalized key combo to plugin id, built once from the configured bindings.
 * Disabled and invalid bindings are left out; on a conflicting combo the first binding wins.
 */
public final class ShortcutTable {

    private static final Logger log = LoggerFactory.getLogger(ShortcutTable.class);

    private final Map<String, String> pluginByCombo;

    private ShortcutTable(Map<String, String> pluginByCombo) {
        this.pluginByCombo = Collections.unmodifiableMap(pluginByCombo);
    }

    public static ShortcutTable empty() {
        return new ShortcutTable(new LinkedHashMap<>());
    }

    public static ShortcutTable build(List<ShortcutBinding> bindings, KeyComboValidator validator) {
        Map<String, String> table = new LinkedHashMap<>();
        if (bindings == null) return new ShortcutTable(table);
        for (ShortcutBinding b : bindings) {
            if (!b.isEnabled()) {
                log.debug("Shortcut {} -> {} is disabled", b.getKeyCombo(), b.getPluginId());
                continue;
            }
            KeyValidationResult result = validator.validate(b.getKeyCombo());
            if (!result.valid()) {
                log.warn("Skipping shortcut {} -> {}: {}{}", b.getKeyCombo(), b.getPluginId(),
                        String.join("; ", result.errors()),
                        result.suggested().map(s -> " (try " + s + ")").orElse(""));
                continue;
            }
            for (String warning : result.warnings()) {
                log.info("Shortcut {}: {}", b.getKeyCombo(), warning);
            }
            String combo = KeyCombos.normalize(b.getKeyCombo());
            String existing = table.putIfAbsent(combo, b.getPluginId());
            if (existing != null && !existing.equals(b.getPluginId())) {
                log.warn("Shortcut {} conflicts: already bound to {}, ignoring binding to {}",
                        combo, existing, b.getPluginId());
            }
        }
        return new ShortcutTable(table);
    }

    /** Plugin id bound to the combo, if any. */
    public Optional<String> lookup(String keyCombo) {
        return Optional.ofNullable(pluginByCombo.get(KeyCombos.normalize(keyCombo)));
    }

    /** Combos bound to a plugin, in configuration order. */
    public List<String> combosFor(String pluginId) {
        return pluginByCombo.entrySet().stream()
                .filter(e -> e.getValue().equals(pluginId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableList());
    }

    public Map<String, String> asMap() {
        return pluginByCombo;
    }

    public int size() {
        return pluginByCombo.size();
    }
}
