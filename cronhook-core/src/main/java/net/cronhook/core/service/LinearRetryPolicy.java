package net.cronhook.core.service;

import java.time.Duration;
import java.util.Objects;

final class LinearRetryPolicy implements RetryPolicy {
    private final Duration base;

    LinearRetryPolicy(Duration base) {
        this.base = Objects.requireNonNull(base);
        if (base.isNegative()) throw new IllegalArgumentException("base backoff must not be negative: " + base);
    }

    @Override
    public Duration nextBackoff(long attempt) {
        return base.multipliedBy(Math.max(1, attempt));
    }

    @Override
    public String toString() {
        return "LinearRetryPolicy{base=" + base + '}';
    }
}
