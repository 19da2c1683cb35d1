package io.foreman.core.resilience;

import io.foreman.api.resilience.CircuitBreakerConfig;
import io.foreman.api.resilience.CircuitBreakerMetrics;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Holds one shared circuit breaker per name.
 * Breakers are created lazily with the registry's config the first time a name is requested.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig config;
    private final Clock clock;

    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.create());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @return the breaker for this name, created on first use
     */
    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, n -> new CircuitBreaker(n, config, clock));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> all() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    /**
     * @return metrics of every breaker, sorted by name
     */
    public List<CircuitBreakerMetrics> metrics() {
        return breakers.values().stream()
                .map(CircuitBreaker::metrics)
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .collect(Collectors.toList());
    }

    /**
     * Reset every breaker to CLOSED.
     */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
