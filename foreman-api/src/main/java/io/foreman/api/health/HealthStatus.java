package io.foreman.api.health;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
