/**
 * Global shortcut routing: {@link com.ltools.shortcuts.ShortcutDispatcher} with its reserved
 * actions, plus key combo normalization and validation used when bindings are loaded.
 */
package com.ltools.shortcuts;
