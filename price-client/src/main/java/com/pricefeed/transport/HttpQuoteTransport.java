package com.pricefeed.transport;

import com.pricefeed.config.PriceClientSettings;
import com.pricefeed.model.QuoteResponse;
import com.pricefeed.model.RateLimitSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link QuoteTransport} over the JDK HTTP client.
 *
 * Sends {@code GET {url}?type={requestType}} and hands back status and body
 * untouched. On 429 the Retry-After header is turned into a {@link RateLimitSignal}.
 */
public final class HttpQuoteTransport implements QuoteTransport {
    private static final Logger logger = LoggerFactory.getLogger(HttpQuoteTransport.class);

    private final HttpClient httpClient;
    private final URI requestUri;
    private final Duration requestTimeout;

    public HttpQuoteTransport(PriceClientSettings settings) {
        this(HttpClient.newBuilder()
                .connectTimeout(settings.requestTimeout())
                .build(),
            settings.quoteApiUrl(), settings.requestType(), settings.requestTimeout());
    }

    public HttpQuoteTransport(HttpClient httpClient, String baseUrl, String requestType, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestUri = URI.create(baseUrl + "?type=" + URLEncoder.encode(requestType, StandardCharsets.UTF_8));
        this.requestTimeout = requestTimeout;
        logger.info("HttpQuoteTransport initialized for {} (timeout {}s)", requestUri, requestTimeout.toSeconds());
    }

    @Override
    public QuoteResponse requestQuote(String symbol) throws IOException, InterruptedException {
        var request = HttpRequest.newBuilder()
                .uri(requestUri)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        logger.debug("Requesting quote for {} from {}", symbol, requestUri);
        var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() == QuoteResponse.TOO_MANY_REQUESTS) {
            String retryAfter = response.headers().firstValue("Retry-After").orElse(null);
            RateLimitSignal signal = RateLimitSignal.fromHeader(retryAfter);
            if (retryAfter != null && signal.retryAfterSeconds().isEmpty()) {
                logger.warn("Invalid Retry-After header: {}, falling back to the configured default wait", retryAfter);
            }
            return new QuoteResponse(response.statusCode(), response.body(), signal);
        }

        if (response.statusCode() >= 400) {
            logger.debug("Quote request for {} returned HTTP {}", symbol, response.statusCode());
        }
        return new QuoteResponse(response.statusCode(), response.body(), null);
    }
}
