package com.dynop.routing.hybrid.engine;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed-window limiter counting provider requests per minute.
 *
 * <p>The window start and count are swapped together with compare-and-set, so the count stays exact
 * under concurrent callers. A caller that finds the window full is told how long to wait for the next one.
 */
public final class RequestRateLimiter {

    static final Duration WINDOW = Duration.ofMinutes(1);

    private final int requestsPerWindow;
    private final Clock clock;
    private final AtomicReference<Window> window;

    /**
     * @param requestsPerMinute permits granted per one-minute window
     * @param clock             time source
     */
    public RequestRateLimiter(int requestsPerMinute, Clock clock) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        this.requestsPerWindow = requestsPerMinute;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = new AtomicReference<>(new Window(clock.millis(), 0));
    }

    /**
     * Attempts to take a permit.
     *
     * @return {@link Duration#ZERO} if a permit was taken, otherwise the time until the current window ends
     */
    public Duration tryAcquire() {
        while (true) {
            long now = clock.millis();
            Window current = window.get();
            Window next;
            if (now - current.startMillis() >= WINDOW.toMillis()) {
                next = new Window(now, 1);
            } else if (current.count() < requestsPerWindow) {
                next = new Window(current.startMillis(), current.count() + 1);
            } else {
                return Duration.ofMillis(Math.max(1, current.startMillis() + WINDOW.toMillis() - now));
            }
            if (window.compareAndSet(current, next)) {
                return Duration.ZERO;
            }
        }
    }

    /**
     * Takes a permit, waiting on {@code delays} for as many windows as necessary.
     *
     * @return a future completing once a permit has been taken
     */
    public CompletableFuture<Void> acquire(DelayScheduler delays) {
        Duration wait = tryAcquire();
        if (wait.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        return delays.delay(wait).thenCompose(ignored -> acquire(delays));
    }

    /**
     * @return permits taken in the current window
     */
    public int getRequestCount() {
        Window current = window.get();
        if (clock.millis() - current.startMillis() >= WINDOW.toMillis()) {
            return 0;
        }
        return current.count();
    }

    public int getRequestsPerMinute() {
        return requestsPerWindow;
    }

    private record Window(long startMillis, int count) {
    }
}
