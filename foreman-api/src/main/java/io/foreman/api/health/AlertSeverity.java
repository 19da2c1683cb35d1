package io.foreman.api.health;

public enum AlertSeverity {
    WARNING,
    CRITICAL
}
