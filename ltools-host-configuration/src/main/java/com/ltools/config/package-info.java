/**
 * Host configuration: {@link com.ltools.config.HostConfig} from environment variables and the
 * static {@link com.ltools.config.ShortcutBinding} list read from the shortcuts file.
 */
package com.ltools.config;
