package io.foreman.api.schedule;

/**
 * Task priority, highest first.
 */
public enum Priority {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW
}
