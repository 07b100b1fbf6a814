package com.github.dimitryivaniuta.telemetry.proxy.ratelimit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-log limiter for outbound engine queries.
 *
 * <p>Keeps the exact timestamp of every admitted request while {@code now - t < window}.
 * A request is admitted when fewer than {@code maxRequests} timestamps remain after pruning;
 * denied attempts are not recorded.
 *
 * <p>The clock is read and the log is updated under one lock, so the log stays in
 * timestamp order. Pruning cost is linear in the window occupancy, which is bounded
 * by {@code maxRequests}.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    @Getter
    private final int maxRequests;
    @Getter
    private final Duration window;
    private final Clock clock;

    private final Deque<Instant> admitted = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        Objects.requireNonNull(window, "window must not be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public boolean isAllowed() {
        lock.lock();
        try {
            Instant now = clock.instant();
            prune(now);
            if (admitted.size() >= maxRequests) {
                log.warn("Rate limit exceeded: {} queries in last {}s", admitted.size(), window.toSeconds());
                return false;
            }
            admitted.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of admitted requests still inside the window. Records nothing.
     */
    public int currentRate() {
        lock.lock();
        try {
            Instant now = clock.instant();
            prune(now);
            return admitted.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time until the oldest admitted request leaves the window, rounded up to whole seconds,
     * never below one second.
     */
    public long retryAfterSeconds() {
        lock.lock();
        try {
            Instant now = clock.instant();
            prune(now);
            Instant oldest = admitted.peekFirst();
            if (oldest == null) return 1L;
            Duration remaining = Duration.between(now, oldest.plus(window));
            long millis = Math.max(0, remaining.toMillis());
            return Math.max(1L, (millis + 999) / 1000);
        } finally {
            lock.unlock();
        }
    }

    // expired timestamps sit at the head
    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!admitted.isEmpty() && !admitted.peekFirst().isAfter(cutoff)) {
            admitted.pollFirst();
        }
    }
}
