package com.ltools.shortcuts;

import com.ltools.config.HostConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks key combinations before they are bound as global shortcuts.
 * Invalid: empty combos and Cmd with 6-9 (unreliable with global hotkeys). Everything else is
 * valid, with warnings for untested keys, macOS system shortcuts, three or more modifiers,
 * Shift+letter and (on darwin) F1-F4.
 */
public final class KeyComboValidator {

    private static final Set<String> STABLE_KEYS = Set.of(
            "a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l", "m",
            "n", "o", "p", "q", "r", "s", "t", "u", "v", "w", "x", "y", "z",
            "0", "1", "2", "3", "4", "5",
            "f1", "f2", "f3", "f4", "f5", "f6", "f7", "f8", "f9", "f10",
            "f11", "f12", "f13", "f14", "f15", "f16", "f17", "f18", "f19",
            "space", "enter", "return", "tab", "escape", "esc");

    private static final Set<String> UNSTABLE_KEYS = Set.of("6", "7", "8", "9");

    private static final Map<String, String> UNSTABLE_ALTERNATIVES = Map.of(
            "cmd+6", "cmd+f6",
            "cmd+7", "cmd+f7",
            "cmd+8", "cmd+f8",
            "cmd+9", "cmd+f9",
            "cmd+shift+6", "cmd+shift+f6",
            "cmd+shift+7", "cmd+shift+f7",
            "cmd+shift+8", "cmd+shift+f8",
            "cmd+shift+9", "cmd+shift+f9");

    private static final Map<String, String> SYSTEM_RESERVED_DARWIN = Map.ofEntries(
            Map.entry("cmd+c", "Copy"),
            Map.entry("cmd+v", "Paste"),
            Map.entry("cmd+x", "Cut"),
            Map.entry("cmd+z", "Undo"),
            Map.entry("cmd+shift+z", "Redo"),
            Map.entry("cmd+a", "Select All"),
            Map.entry("cmd+s", "Save"),
            Map.entry("cmd+f", "Find"),
            Map.entry("cmd+q", "Quit Application"),
            Map.entry("cmd+w", "Close Window"),
            Map.entry("cmd+h", "Hide Application"),
            Map.entry("cmd+m", "Minimize"),
            Map.entry("cmd+n", "New Window/Document"),
            Map.entry("cmd+o", "Open"),
            Map.entry("cmd+p", "Print"),
            Map.entry("cmd+t", "New Tab"),
            Map.entry("cmd+shift+t", "Reopen Closed Tab"),
            Map.entry("cmd+l", "Focus Location Bar"),
            Map.entry("cmd+r", "Reload"),
            Map.entry("cmd+shift+r", "Hard Reload"),
            Map.entry("cmd+u", "View Source"),
            Map.entry("cmd+d", "Bookmark"),
            Map.entry("cmd+i", "Page Info"),
            Map.entry("cmd+j", "Downloads/Information"),
            Map.entry("cmd+k", "Search/Focus Search"),
            Map.entry("cmd+y", "History/Redo"),
            Map.entry("cmd+0", "Reset Zoom"),
            Map.entry("cmd+1", "Navigate to Tab 1"),
            Map.entry("cmd+2", "Navigate to Tab 2"),
            Map.entry("cmd+3", "Navigate to Tab 3"),
            Map.entry("cmd+4", "Navigate to Tab 4"),
            Map.entry("cmd+5", "Navigate to Tab 5"),
            Map.entry("cmd+=", "Zoom In"),
            Map.entry("cmd+[", "Back"),
            Map.entry("cmd+]", "Forward"),
            Map.entry("cmd+~", "Switch Window"),
            Map.entry("cmd+shift+~", "Switch Window Reverse"),
            Map.entry("cmd+?", "Help"),
            Map.entry("cmd+shift+a", "Applications"),
            Map.entry("cmd+option+esc", "Force Quit"),
            Map.entry("cmd+shift+3", "Screenshot"),
            Map.entry("cmd+shift+4", "Screenshot Selection"),
            Map.entry("cmd+shift+5", "Screenshot Options"),
            Map.entry("cmd+space", "Spotlight Search"),
            Map.entry("cmd+option+space", "Spotlight in Finder"),
            Map.entry("cmd+ctrl+space", "Character Viewer"),
            Map.entry("cmd+shift+option+esc", "Force Quit Front App"));

    private final String platform;
    private final boolean allowSystemReserved;

    public KeyComboValidator(String platform) {
        this(platform, false);
    }

    public KeyComboValidator(String platform, boolean allowSystemReserved) {
        this.platform = platform != null ? platform : HostConfig.PLATFORM_DARWIN;
        this.allowSystemReserved = allowSystemReserved;
    }

    public KeyValidationResult validate(String keyCombo) {
        String normalized = KeyCombos.normalize(keyCombo);
        List<String> parts = KeyCombos.split(normalized);
        List<String> warnings = new ArrayList<>();
        if (parts.isEmpty()) {
            return new KeyValidationResult(false, KeyStability.STABLE, warnings,
                    List.of("key combination is empty"), null);
        }

        String mainKey = "";
        boolean hasCmd = false;
        int modifierCount = 0;
        boolean hasShift = false;
        for (String part : parts) {
            if (KeyCombos.isModifier(part)) {
                modifierCount++;
                hasCmd |= KeyCombos.isCommand(part);
                hasShift |= part.equals("shift");
            } else {
                mainKey = part;
            }
        }

        if (hasCmd && UNSTABLE_KEYS.contains(mainKey)) {
            String suggestion = UNSTABLE_ALTERNATIVES.getOrDefault(normalized, "cmd+f" + mainKey);
            return new KeyValidationResult(false, KeyStability.UNSTABLE, warnings,
                    List.of("key '" + mainKey + "' is unstable when combined with Cmd modifier on " + platform),
                    suggestion);
        }

        KeyStability stability = KeyStability.STABLE;
        if (hasCmd && !STABLE_KEYS.contains(mainKey)) {
            warnings.add("key '" + mainKey + "' has not been extensively tested with Cmd modifier");
            stability = KeyStability.MOSTLY_STABLE;
        }
        if (hasCmd && !allowSystemReserved) {
            String systemFunction = SYSTEM_RESERVED_DARWIN.get(normalized);
            if (systemFunction != null) {
                warnings.add("Cmd+" + mainKey + " is reserved by the system for: " + systemFunction);
                stability = KeyStability.SYSTEM_RESERVED;
            }
        }
        if (modifierCount >= 3) {
            warnings.add("key combination uses 3 or more modifiers - may be difficult to use");
            if (stability == KeyStability.STABLE) stability = KeyStability.MOSTLY_STABLE;
        }
        if (modifierCount == 1 && hasShift && mainKey.length() == 1 && Character.isLetter(mainKey.charAt(0))) {
            warnings.add("Shift+Letter combinations are redundant - use uppercase letter directly");
        }
        if (HostConfig.PLATFORM_DARWIN.equals(platform)) {
            for (String part : parts) {
                if (part.equals("f1") || part.equals("f2") || part.equals("f3") || part.equals("f4")) {
                    warnings.add(part.toUpperCase() + " is reserved for system functions (brightness, Mission Control)");
                    stability = KeyStability.SYSTEM_RESERVED;
                }
            }
        }
        return new KeyValidationResult(true, stability, warnings, List.of(), null);
    }
}
