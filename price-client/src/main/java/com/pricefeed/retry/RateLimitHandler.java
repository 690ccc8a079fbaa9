package com.pricefeed.retry;

import com.pricefeed.config.ClientConfig;
import com.pricefeed.model.RateLimitSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Turns a rate-limit signal into a wait-or-fail decision. Never sleeps itself.
 */
public class RateLimitHandler {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitHandler.class);

    public RateLimitDecision handle(RateLimitSignal signal, ClientConfig config) {
        RateLimitSignal effective = signal != null ? signal : RateLimitSignal.unspecified();

        if (config.failFastOnRateLimit()) {
            logger.warn("Rate limited (fail-fast), retry-after={}", describe(effective));
            return new RateLimitDecision.Fail(effective.retryAfterSeconds());
        }

        Duration wait = effective.retryAfterSeconds().isPresent()
            ? Duration.ofSeconds(effective.retryAfterSeconds().getAsInt())
            : config.defaultRateLimitWait();
        logger.warn("Rate limited. Waiting {} seconds before one more attempt", wait.toSeconds());
        return new RateLimitDecision.Wait(wait);
    }

    private String describe(RateLimitSignal signal) {
        return signal.retryAfterSeconds().isPresent()
            ? signal.retryAfterSeconds().getAsInt() + "s"
            : "unspecified";
    }
}
