package com.ltools.plugin;

/** Where a plugin comes from. */
public enum PluginType {
    /** Shipped with the host. */
    BUILTIN,
    /** Loaded from a JAR in the plugins directory. */
    EXTERNAL
}
