package dev.apiproxy.plugin;

/**
 * Lifecycle of a plugin session. {@link #TERMINATED} is final.
 */
public enum SessionState {
    UNINITIALIZED,
    READY,
    TERMINATED
}
