/**
 * Navigation: the derived menu ({@link com.ltools.navigation.NavigationSynchronizer}), routing
 * ({@link com.ltools.navigation.HostRouter}) and page enter/leave hooks
 * ({@link com.ltools.navigation.PageGuard}).
 */
package com.ltools.navigation;
