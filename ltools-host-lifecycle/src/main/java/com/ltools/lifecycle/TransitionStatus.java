package com.ltools.lifecycle;

/** Outcome kind of a lifecycle request. */
public enum TransitionStatus {
    /** The transition ran and the state changed. */
    APPLIED,
    /** Nothing to do; the plugin was already in the requested state. */
    NO_OP,
    /** A hook failed; the plugin is now in ERROR (or the request was rejected). */
    FAILED,
    /** No plugin with that id is registered. */
    UNKNOWN_PLUGIN
}
