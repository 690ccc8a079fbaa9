package com.pricefeed.retry;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * What to do about a rate-limit signal.
 */
public sealed interface RateLimitDecision permits RateLimitDecision.Wait, RateLimitDecision.Fail {

    /**
     * Sleep for the duration, then make exactly one more attempt.
     */
    record Wait(Duration duration) implements RateLimitDecision {
    }

    /**
     * Give up now and hand the retry-after hint, if any, to the caller.
     */
    record Fail(OptionalInt retryAfterSeconds) implements RateLimitDecision {
    }
}
