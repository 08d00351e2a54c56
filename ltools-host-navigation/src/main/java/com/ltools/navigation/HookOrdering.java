package com.ltools.navigation;

/**
 * How the enter hook of the next page is ordered against the leave hook of the previous one.
 */
public enum HookOrdering {
    /** Both hooks are submitted (leave first) and may overlap. */
    CONCURRENT,
    /** The enter hook starts only after the leave hook has completed. */
    SEQUENTIAL;

    /** Parses a config value; unknown or blank values give {@link #CONCURRENT}. */
    public static HookOrdering parse(String value) {
        if (value == null || value.isBlank()) return CONCURRENT;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return CONCURRENT;
        }
    }
}
