package com.pwn.writeups.crawl.service;

import java.time.Clock;
import java.time.Instant;

/**
 * Run-level stop signal shared by every resolution task of one crawl.
 * Expires at a fixed instant (if any) or when {@link #cancel()} is called.
 */
public class CrawlDeadline {
    private final Clock clock;
    private final Instant expiresAt;
    private volatile boolean cancelled;

    public CrawlDeadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static CrawlDeadline none() {
        return new CrawlDeadline(Clock.systemUTC(), null);
    }

    public static CrawlDeadline after(Clock clock, int maxDurationSeconds) {
        if (maxDurationSeconds <= 0) {
            return new CrawlDeadline(clock, null);
        }
        return new CrawlDeadline(clock, clock.instant().plusSeconds(maxDurationSeconds));
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isExpired() {
        if (cancelled) {
            return true;
        }
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public Instant expiresAt() {
        return expiresAt;
    }
}
