package me.internalizable.relay.scheduler;

/**
 * State of a {@link ScheduledTask}.
 */
public enum TaskStatus {
    SCHEDULED,
    RUNNING,
    FINISHED,
    CANCELLED
}
