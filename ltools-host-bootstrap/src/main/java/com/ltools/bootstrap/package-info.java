/**
 * Host wiring. {@link com.ltools.bootstrap.HostBootstrap} builds every component around one
 * event bus and returns the {@link com.ltools.bootstrap.HostContext} facade.
 */
package com.ltools.bootstrap;
