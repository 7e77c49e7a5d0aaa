package com.chronoline.timeline.core.service;

import java.time.Instant;

/**
 * Fired via CDI whenever a {@link ManagedService} changes state. {@code cause}
 * is set only for transitions into FAILED.
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        Throwable cause,
        Instant timestamp
) {

    public boolean isFailure() {
        return newState == ManagedService.State.FAILED;
    }

    public boolean isRunning() {
        return newState == ManagedService.State.RUNNING;
    }
}
