package com.largomodo.retrohub.ipc;

/**
 * Lifecycle of an {@link IpcServer}: STOPPED → STARTING → RUNNING → STOPPING → STOPPED.
 */
public enum ServerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
