/**
 * Plugin data model and registry: {@link com.ltools.plugin.PluginMetadata},
 * {@link com.ltools.plugin.PluginRegistry}, the {@link com.ltools.plugin.PluginCapability} SPI
 * and discovery through {@link com.ltools.plugin.PluginProvider} / {@link com.ltools.plugin.PluginManager}.
 */
package com.ltools.plugin;
