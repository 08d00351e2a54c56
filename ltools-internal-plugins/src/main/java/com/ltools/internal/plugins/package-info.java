/**
 * Builtin plugin providers and external plugin discovery for the host.
 */
package com.ltools.internal.plugins;
