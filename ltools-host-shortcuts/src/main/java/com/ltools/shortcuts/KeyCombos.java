package com.ltools.shortcuts;

import com.ltools.config.HostConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Key combination helpers. Combos are written as {@code modifier+...+key}; normalization
 * lower-cases, drops spaces and accepts {@code -} and {@code _} as separators.
 */
public final class KeyCombos {

    private KeyCombos() {
    }

    /** Modifier part and main key of a combo. Empty strings when absent. */
    public record Parsed(String modifiers, String key) {
    }

    public static String normalize(String keyCombo) {
        if (keyCombo == null) return "";
        return keyCombo.toLowerCase()
                .replace(" ", "")
                .replace('-', '+')
                .replace('_', '+');
    }

    /** Non-empty parts of a combo, in order. */
    public static List<String> split(String keyCombo) {
        List<String> parts = new ArrayList<>();
        for (String part : normalize(keyCombo).split("\\+")) {
            if (!part.isEmpty()) parts.add(part);
        }
        return parts;
    }

    public static boolean isModifier(String part) {
        return switch (part) {
            case "ctrl", "control", "shift", "alt", "option", "cmd", "command", "meta" -> true;
            default -> false;
        };
    }

    static boolean isCommand(String part) {
        return part.equals("cmd") || part.equals("command") || part.equals("meta");
    }

    /**
     * Canonical modifier names ({@code ctrl}, {@code cmd}, {@code shift}, {@code alt}) and the
     * lower-case main key.
     */
    public static Parsed parse(String keyCombo) {
        List<String> modifiers = new ArrayList<>();
        String key = "";
        for (String part : split(keyCombo)) {
            switch (part) {
                case "ctrl", "control" -> modifiers.add("ctrl");
                case "cmd", "command", "meta" -> modifiers.add("cmd");
                case "shift" -> modifiers.add("shift");
                case "alt", "option" -> modifiers.add("alt");
                default -> key = part;
            }
        }
        return new Parsed(String.join("+", modifiers), key);
    }

    /** Display form: macOS symbols on darwin, words elsewhere; main key upper-cased. */
    public static String format(String keyCombo, String platform) {
        boolean darwin = HostConfig.PLATFORM_DARWIN.equals(platform);
        List<String> out = new ArrayList<>();
        String key = "";
        for (String part : split(keyCombo)) {
            switch (part) {
                case "ctrl", "control" -> out.add(darwin ? "⌘" : "Ctrl");
                case "cmd", "command", "meta" -> out.add(darwin ? "⌘" : "Win");
                case "shift" -> out.add(darwin ? "⇧" : "Shift");
                case "alt", "option" -> out.add(darwin ? "⌥" : "Alt");
                default -> key = part.toUpperCase();
            }
        }
        if (!key.isEmpty()) out.add(key);
        return String.join("+", out);
    }
}
