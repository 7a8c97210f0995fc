package com.marketterminal.market_terminal.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding one-minute window limiter for outbound broker calls.
 */
@Slf4j
public class RateLimiter {
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final int maxRequestsPerMinute;
    private final Deque<Instant> issued = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public RateLimiter(int maxRequestsPerMinute) {
        if (maxRequestsPerMinute <= 0) {
            throw new IllegalArgumentException("maxRequestsPerMinute must be positive");
        }
        this.maxRequestsPerMinute = maxRequestsPerMinute;
    }

    /**
     * Takes a permit, sleeping until the oldest request leaves the window when none is free.
     * @return true if a permit was taken, false if interrupted while waiting
     */
    public boolean acquire() {
        while (true) {
            long waitMs;
            lock.lock();
            try {
                Instant now = Instant.now();
                evictExpired(now);
                if (issued.size() < maxRequestsPerMinute) {
                    issued.addLast(now);
                    return true;
                }
                waitMs = Duration.between(now, issued.peekFirst().plus(WINDOW)).toMillis() + 1;
            } finally {
                lock.unlock();
            }

            log.info("Broker rate limit of {} requests/minute reached, waiting {} ms", maxRequestsPerMinute, waitMs);
            try {
                Thread.sleep(Math.max(waitMs, 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for rate limit");
                return false;
            }
        }
    }

    /**
     * Permits that could be taken right now without waiting.
     */
    public int available() {
        lock.lock();
        try {
            evictExpired(Instant.now());
            return maxRequestsPerMinute - issued.size();
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!issued.isEmpty() && issued.peekFirst().isBefore(cutoff)) {
            issued.pollFirst();
        }
    }
}
