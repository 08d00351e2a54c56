package com.ltools.plugin;

/**
 * Enablement state of a registered plugin.
 * <pre>
 * INSTALLED -&gt; ENABLED &lt;-&gt; DISABLED
 * any -&gt; ERROR, left only by an explicit enable retry
 * </pre>
 */
public enum PluginState {
    INSTALLED,
    ENABLED,
    DISABLED,
    ERROR
}
