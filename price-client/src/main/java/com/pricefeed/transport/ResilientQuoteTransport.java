package com.pricefeed.transport;

import com.pricefeed.config.PriceClientSettings;
import com.pricefeed.model.QuoteResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Decorator adding connection-level protection to a {@link QuoteTransport}.
 *
 * Features:
 * - Rate Limiter: keeps us inside the quote source's request budget
 * - Circuit Breaker: stops hammering a source that keeps failing (I/O errors, 5xx)
 *
 * Rejections are reported as {@link QuoteSourceUnavailableException}, which the
 * price client treats like any other transient transport failure. Retries are
 * not done here; they belong to the price client's own retry policy.
 */
public final class ResilientQuoteTransport implements QuoteTransport {
    private static final Logger logger = LoggerFactory.getLogger(ResilientQuoteTransport.class);

    private final QuoteTransport delegate;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;

    public ResilientQuoteTransport(QuoteTransport delegate, PriceClientSettings settings) {
        this(delegate,
            CircuitBreaker.of("quote-source", circuitBreakerConfig(settings)),
            RateLimiter.of("quote-source", rateLimiterConfig(settings)));
    }

    public ResilientQuoteTransport(QuoteTransport delegate, CircuitBreaker circuitBreaker, RateLimiter rateLimiter) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("Quote source circuit breaker state changed: {}", event.getStateTransition()));

        logger.info("ResilientQuoteTransport initialized with circuit breaker and rate limiter");
    }

    static CircuitBreakerConfig circuitBreakerConfig(PriceClientSettings settings) {
        return CircuitBreakerConfig.custom()
            .failureRateThreshold(settings.circuitFailureRateThreshold())
            .waitDurationInOpenState(settings.circuitOpenDuration())
            .slidingWindowSize(10)
            .minimumNumberOfCalls(10)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .recordExceptions(IOException.class)
            .recordResult(result -> result instanceof QuoteResponse response && response.isServerError())
            .build();
    }

    static RateLimiterConfig rateLimiterConfig(PriceClientSettings settings) {
        return RateLimiterConfig.custom()
            .limitForPeriod(settings.requestsPerMinute())
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(settings.requestTimeout())
            .build();
    }

    @Override
    public QuoteResponse requestQuote(String symbol) throws IOException, InterruptedException {
        Callable<QuoteResponse> call = RateLimiter.decorateCallable(rateLimiter,
            CircuitBreaker.decorateCallable(circuitBreaker, () -> delegate.requestQuote(symbol)));
        try {
            return call.call();
        } catch (CallNotPermittedException e) {
            throw new QuoteSourceUnavailableException("Circuit breaker open for quote source", e);
        } catch (RequestNotPermitted e) {
            throw new QuoteSourceUnavailableException("No request permit for quote source within timeout", e);
        } catch (IOException | InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Quote request for " + symbol + " failed", e);
        }
    }

    /**
     * Get current circuit breaker state for health checks.
     */
    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    /**
     * Manually reset the circuit breaker.
     */
    public void resetCircuitBreaker() {
        logger.info("🔄 Manual circuit breaker reset requested");
        circuitBreaker.reset();
    }
}
