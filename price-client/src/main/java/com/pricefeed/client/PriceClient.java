package com.pricefeed.client;

import com.pricefeed.cache.InMemoryPriceCache;
import com.pricefeed.cache.PriceCache;
import com.pricefeed.config.ClientConfig;
import com.pricefeed.error.DataIntegrityException;
import com.pricefeed.error.ErrorClassifier;
import com.pricefeed.error.ErrorKind;
import com.pricefeed.error.FetchFailure;
import com.pricefeed.error.InvalidSymbolException;
import com.pricefeed.error.NoDataAvailableException;
import com.pricefeed.error.RateLimitException;
import com.pricefeed.metrics.PriceClientMetrics;
import com.pricefeed.model.PriceRecord;
import com.pricefeed.model.QuoteResponse;
import com.pricefeed.model.RateLimitSignal;
import com.pricefeed.retry.RateLimitDecision;
import com.pricefeed.retry.RateLimitHandler;
import com.pricefeed.retry.RetryController;
import com.pricefeed.retry.Sleeper;
import com.pricefeed.transport.QuoteTransport;
import com.pricefeed.validation.PriceValidator;
import com.pricefeed.validation.ValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Fetches a trustworthy price for a symbol, or fails with a typed error.
 *
 * Pipeline per fetch:
 * <ol>
 *   <li>reject a null or blank symbol before any network call</li>
 *   <li>request the quote, validate the body</li>
 *   <li>on a 429, wait once (or fail fast) per {@link RateLimitHandler}</li>
 *   <li>retry transient and incomplete failures with exponential backoff</li>
 *   <li>once retries are exhausted, serve the cached price as a degraded result</li>
 * </ol>
 * Data-integrity failures are never retried and never masked by the cache;
 * a stale but valid cached price is safer than a corrupted fresh one.
 *
 * Thread-safe. Fetches for different symbols are independent; the cache is the
 * only shared state.
 */
public class PriceClient {
    private static final Logger logger = LoggerFactory.getLogger(PriceClient.class);
    private static final String OPERATION = "fetch";
    private static final String INVALID_SYMBOL_TAG = "<invalid>";

    private final QuoteTransport transport;
    private final PriceCache cache;
    private final PriceValidator validator;
    private final ErrorClassifier classifier;
    private final RetryController retryController;
    private final RateLimitHandler rateLimitHandler;
    private final Sleeper sleeper;
    private final PriceClientMetrics metrics;
    private final Clock clock;
    private final ClientConfig defaultConfig;

    public PriceClient(QuoteTransport transport) {
        this(transport, ClientConfig.defaults(), new SimpleMeterRegistry());
    }

    /**
     * Client with a private in-memory cache, real sleeps and the system clock.
     */
    public PriceClient(QuoteTransport transport, ClientConfig defaultConfig, MeterRegistry meterRegistry) {
        this(transport, new InMemoryPriceCache(), Sleeper.THREAD_SLEEP, Clock.systemUTC(), meterRegistry, defaultConfig);
    }

    /**
     * Full constructor. Pass the same cache to several clients to share it;
     * tests inject a recording sleeper and a fixed clock.
     */
    public PriceClient(QuoteTransport transport, PriceCache cache, Sleeper sleeper, Clock clock,
                       MeterRegistry meterRegistry, ClientConfig defaultConfig) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.validator = new PriceValidator();
        this.classifier = new ErrorClassifier();
        this.retryController = new RetryController(sleeper);
        this.rateLimitHandler = new RateLimitHandler();
        this.metrics = new PriceClientMetrics(Objects.requireNonNull(meterRegistry, "meterRegistry"));

        logger.info("PriceClient initialized (maxRetries={}, backoffBase={}ms, failFast={})",
            defaultConfig.maxRetries(), defaultConfig.backoffBase().toMillis(), defaultConfig.failFastOnRateLimit());
    }

    /**
     * Fetch with the client's default config.
     */
    public PriceResult fetch(String symbol) throws InterruptedException {
        return fetch(symbol, defaultConfig);
    }

    /**
     * Fetch the current price of a symbol.
     *
     * @return a fresh price, or a degraded one from cache after transient failures
     * @throws InvalidSymbolException    symbol is null or blank; no request was made
     * @throws DataIntegrityException    the source returned data that must not be trusted
     * @throws NoDataAvailableException  retries exhausted and nothing cached
     * @throws RateLimitException        rate limited in fail-fast mode, or again after waiting
     * @throws InterruptedException      interrupted while waiting; nothing was cached
     */
    public PriceResult fetch(String symbol, ClientConfig config) throws InterruptedException {
        Objects.requireNonNull(config, "config");
        if (classifier.classifySymbol(symbol) == ErrorKind.INVALID_INPUT) {
            metrics.recordFailure(INVALID_SYMBOL_TAG, ErrorKind.INVALID_INPUT);
            throw new InvalidSymbolException(symbol, OPERATION);
        }

        long startNanos = System.nanoTime();
        var context = new FetchContext(symbol, config);
        try {
            PriceRecord record = retryController.execute(OPERATION + " " + symbol,
                context::attempt, config.maxRetries(), config.backoffBase());

            cache.put(record);
            metrics.recordSuccess(symbol);
            logger.info("Successfully fetched price for {}: {}", symbol, record.price());
            return PriceResult.fresh(record);
        } catch (FetchFailure failure) {
            return handleFailure(symbol, failure, context);
        } finally {
            metrics.recordLatency(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    public PriceCache getCache() {
        return cache;
    }

    public ClientConfig getDefaultConfig() {
        return defaultConfig;
    }

    private PriceResult handleFailure(String symbol, FetchFailure failure, FetchContext context) {
        int attempts = context.attempts;
        ErrorKind kind = failure.getKind();
        metrics.recordFailure(symbol, kind);

        if (kind.permitsCacheFallback()) {
            Optional<PriceRecord> cached = cache.get(symbol);
            if (cached.isPresent()) {
                PriceRecord record = cached.get();
                metrics.recordDegraded(symbol, kind);
                logger.warn("⚠️ Using cached price for {} after {} failure: {} (observed at {})",
                    symbol, kind, record.price(), record.observedAt());
                return PriceResult.fromCache(record, kind);
            }
            String message = "No price available for " + symbol + " after " + attempts
                + " attempt(s) and no cached value: " + failure.getMessage();
            logger.error(message);
            throw new NoDataAvailableException(symbol, OPERATION, attempts, kind, message, failure);
        }

        // The cache is only inspected to report whether a value existed; it is never served here
        boolean cachedValueAvailable = cache.get(symbol).isPresent();
        if (kind == ErrorKind.DATA_INTEGRITY) {
            logger.error("🚨 Data integrity failure for {}: {}", symbol, failure.getMessage());
            throw new DataIntegrityException(symbol, OPERATION, attempts, cachedValueAvailable,
                failure.getViolation().orElse(null), failure.getMessage(), failure);
        }
        if (kind == ErrorKind.RATE_LIMITED) {
            OptionalInt retryAfter = context.retryAfterSeconds;
            String message = retryAfter.isPresent()
                ? "Rate limited fetching " + symbol + ". Retry after " + retryAfter.getAsInt() + " seconds"
                : "Rate limited fetching " + symbol;
            throw new RateLimitException(symbol, OPERATION, attempts, cachedValueAvailable,
                retryAfter, message, failure);
        }
        throw new IllegalStateException("Unexpected failure kind " + kind + " for " + symbol, failure);
    }

    /**
     * State of one fetch call: attempt count, whether the single rate-limit
     * wait has been spent, and the retry-after reported with a final 429.
     */
    private final class FetchContext {
        private final String symbol;
        private final ClientConfig config;
        private int attempts;
        private boolean rateLimitWaitUsed;
        private OptionalInt retryAfterSeconds = OptionalInt.empty();

        FetchContext(String symbol, ClientConfig config) {
            this.symbol = symbol;
            this.config = config;
        }

        PriceRecord attempt() throws FetchFailure, InterruptedException {
            try {
                return requestAndValidate();
            } catch (FetchFailure failure) {
                if (failure.getKind() != ErrorKind.RATE_LIMITED) {
                    throw failure;
                }
                var signal = failure.getRateLimitSignal().orElse(RateLimitSignal.unspecified());
                if (rateLimitWaitUsed) {
                    retryAfterSeconds = signal.retryAfterSeconds();
                    throw failure;
                }
                var decision = rateLimitHandler.handle(signal, config);
                if (decision instanceof RateLimitDecision.Fail fail) {
                    retryAfterSeconds = fail.retryAfterSeconds();
                    throw failure;
                }
                var wait = (RateLimitDecision.Wait) decision;
                rateLimitWaitUsed = true;
                sleeper.sleep(wait.duration());
                logger.info("Retrying {} after rate-limit wait", symbol);
                return attempt();
            }
        }

        private PriceRecord requestAndValidate() throws FetchFailure, InterruptedException {
            attempts++;
            metrics.recordAttempt(symbol);

            QuoteResponse response;
            try {
                response = transport.requestQuote(symbol);
            } catch (IOException e) {
                throw classifier.failureFor(symbol, e);
            }
            if (response == null) {
                throw classifier.failureFor(symbol, new IOException("Transport returned no response"));
            }
            if (!response.isSuccessful()) {
                throw classifier.failureFor(symbol, response);
            }

            ValidationResult result = validator.validate(response.body(), symbol);
            if (!result.isValid()) {
                throw classifier.failureFor(result);
            }
            return new PriceRecord(symbol, result.price(), clock.instant());
        }
    }
}
