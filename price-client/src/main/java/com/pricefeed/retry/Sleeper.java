package com.pricefeed.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Suspension point for backoff and rate-limit waits. Must respond to thread
 * interruption so a caller can abandon a fetch.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
