/**
 * Annotations and contracts shared by the host and its plugins: {@link com.ltools.annotations.HostPlugin}
 * for plugin identity and {@link com.ltools.annotations.ResourceCleanup} for shutdown cleanup.
 */
package com.ltools.annotations;
