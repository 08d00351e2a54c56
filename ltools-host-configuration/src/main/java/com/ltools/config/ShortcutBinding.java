package com.ltools.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static shortcut binding: a key combination mapped to a plugin id. Bindings are read once at
 * startup from the shortcuts file ({@code [{"keyCombo":"ctrl+5","pluginId":"search.window.builtin","enabled":true}]})
 * and are read-only afterwards.
 */
public final class ShortcutBinding {

    private static final Logger log = LoggerFactory.getLogger(ShortcutBinding.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** Plugin id of the search window toggle action. */
    public static final String SEARCH_WINDOW_ID = "search.window.builtin";
    /** Plugin id of the one-shot screenshot capture action. */
    public static final String SCREENSHOT_ID = "screenshot2.window.builtin";

    private final String keyCombo;
    private final String pluginId;
    private final boolean enabled;

    @JsonCreator
    public ShortcutBinding(@JsonProperty("keyCombo") String keyCombo,
                           @JsonProperty("pluginId") String pluginId,
                           @JsonProperty("enabled") Boolean enabled) {
        this.keyCombo = keyCombo != null ? keyCombo.trim() : "";
        this.pluginId = pluginId != null ? pluginId.trim() : "";
        this.enabled = enabled == null || enabled;
    }

    public ShortcutBinding(String keyCombo, String pluginId) {
        this(keyCombo, pluginId, Boolean.TRUE);
    }

    @JsonProperty("keyCombo")
    public String getKeyCombo() {
        return keyCombo;
    }

    @JsonProperty("pluginId")
    public String getPluginId() {
        return pluginId;
    }

    @JsonProperty("enabled")
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Default bindings used when no shortcuts file exists: search window and screenshot capture,
     * with Cmd on macOS and Ctrl elsewhere.
     */
    public static List<ShortcutBinding> defaults(String platform) {
        String mod = HostConfig.PLATFORM_DARWIN.equals(platform) ? "cmd" : "ctrl";
        return List.of(
                new ShortcutBinding(mod + "+5", SEARCH_WINDOW_ID),
                new ShortcutBinding(mod + "+shift+s", SCREENSHOT_ID));
    }

    /**
     * Parses a JSON array of bindings. Entries without a key combo or plugin id are skipped.
     *
     * @param json JSON array of {@code {"keyCombo":"...","pluginId":"...","enabled":true}}
     * @return bindings in file order, or empty list if json is null/blank
     * @throws IllegalArgumentException if json is not a valid array of bindings
     */
    public static List<ShortcutBinding> parseBindings(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid shortcut bindings JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Shortcut bindings must be a JSON array");
        }
        List<ShortcutBinding> out = new ArrayList<>();
        for (JsonNode node : root) {
            ShortcutBinding binding = MAPPER.convertValue(node, ShortcutBinding.class);
            if (binding.keyCombo.isEmpty() || binding.pluginId.isEmpty()) {
                log.warn("Skipping shortcut binding without keyCombo or pluginId: {}", node);
                continue;
            }
            out.add(binding);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Loads bindings from the given file, or returns {@link #defaults(String)} when the file does not exist.
     * An unreadable or malformed file is logged and also falls back to the defaults.
     */
    public static List<ShortcutBinding> load(Path file, String platform) {
        if (file == null || !Files.isRegularFile(file)) {
            log.info("No shortcuts file at {}; using default bindings for {}", file, platform);
            return defaults(platform);
        }
        try {
            List<ShortcutBinding> bindings = parseBindings(Files.readString(file));
            log.info("Loaded {} shortcut binding(s) from {}", bindings.size(), file);
            return bindings;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not read shortcuts file {} ({}); using default bindings", file, e.getMessage());
            return defaults(platform);
        }
    }

    /** Serializes bindings as a JSON array (same shape {@link #parseBindings(String)} reads). */
    public static String toJsonArray(List<ShortcutBinding> bindings) {
        try {
            return MAPPER.writeValueAsString(bindings != null ? bindings : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize shortcut bindings", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShortcutBinding)) return false;
        ShortcutBinding that = (ShortcutBinding) o;
        return enabled == that.enabled && keyCombo.equals(that.keyCombo) && pluginId.equals(that.pluginId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyCombo, pluginId, enabled);
    }

    @Override
    public String toString() {
        return keyCombo + " -> " + pluginId + (enabled ? "" : " (disabled)");
    }
}
