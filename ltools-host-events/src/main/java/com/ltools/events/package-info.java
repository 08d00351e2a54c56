/**
 * Event bus of the host: {@link com.ltools.events.EventBus} with typed {@link com.ltools.events.Topic}s,
 * {@link com.ltools.events.Subscription} handles, and the {@link com.ltools.events.LifecycleEvent}
 * published for every plugin registry mutation.
 */
package com.ltools.events;
