package com.pwn.writeups.crawl.service;

import com.pwn.writeups.config.CrawlerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter: after failed attempt {@code i} (0-based) the delay is
 * {@code 2^(i + u) * baseDelayMs} milliseconds, with {@code u} drawn uniformly from [0, 1) per call.
 */
@Component
public class RetryBackoff {
    private static final int MAX_EXPONENT = 30;

    private final CrawlerProperties properties;
    private final DoubleSupplier jitter;
    private final Sleeper sleeper;

    @Autowired
    public RetryBackoff(CrawlerProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble(), delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos()));
    }

    RetryBackoff(CrawlerProperties properties, DoubleSupplier jitter, Sleeper sleeper) {
        this.properties = properties;
        this.jitter = jitter;
        this.sleeper = sleeper;
    }

    public Duration delayFor(int attemptIndex) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return Duration.ZERO;
        }
        double u = Math.min(Math.max(jitter.getAsDouble(), 0.0), 1.0);
        double exponent = Math.min(Math.max(0, attemptIndex), MAX_EXPONENT) + u;
        double delayMs = Math.pow(2.0, exponent) * baseDelayMs;
        return Duration.ofNanos(Math.round(delayMs * 1_000_000d));
    }

    /**
     * Blocks the calling worker for the given delay.
     *
     * @return false if the sleep was interrupted; the interrupt flag is restored
     */
    public boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }
}
