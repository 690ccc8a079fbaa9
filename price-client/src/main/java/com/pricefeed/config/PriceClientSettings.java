package com.pricefeed.config;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Process-level settings for the price client.
 * Loaded from {@code price-client.properties} on the classpath; environment
 * variables with the same key take precedence.
 */
public final class PriceClientSettings {
    private static final Logger logger = LoggerFactory.getLogger(PriceClientSettings.class);
    private static final String CONFIG_RESOURCE = "price-client.properties";
    private static final String DEFAULT_QUOTE_API_URL = "https://api.hyperliquid.xyz/info";

    @NotBlank(message = "Quote API URL is required")
    @Pattern(regexp = "^https?://.*", message = "Quote API URL must be http(s)")
    private final String quoteApiUrl;

    @NotBlank(message = "Quote request type is required")
    private final String requestType;

    @Positive
    private final long requestTimeoutSeconds;

    @PositiveOrZero
    private final int maxRetries;

    @Positive
    private final long backoffBaseMs;

    private final boolean failFastOnRateLimit;

    @PositiveOrZero
    private final long defaultRateLimitWaitSeconds;

    @Positive
    private final int requestsPerMinute;

    @Min(1)
    @Max(100)
    private final int circuitFailureRateThreshold;

    @Positive
    private final long circuitOpenSeconds;

    private final Properties properties;
    private final Map<String, String> environment;

    private PriceClientSettings(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment;

        this.quoteApiUrl = getString("QUOTE_API_URL", DEFAULT_QUOTE_API_URL);
        this.requestType = getString("QUOTE_API_REQUEST_TYPE", "metaAndAssetCtxs");
        this.requestTimeoutSeconds = getLong("QUOTE_API_TIMEOUT_SECONDS", 10);
        this.maxRetries = getInt("MAX_RETRIES", ClientConfig.DEFAULT_MAX_RETRIES);
        this.backoffBaseMs = getLong("BACKOFF_BASE_MS", ClientConfig.DEFAULT_BACKOFF_BASE.toMillis());
        this.failFastOnRateLimit = getBoolean("FAIL_FAST_ON_RATE_LIMIT", false);
        this.defaultRateLimitWaitSeconds = getLong("DEFAULT_RATE_LIMIT_WAIT_SECONDS",
            ClientConfig.DEFAULT_RATE_LIMIT_WAIT.toSeconds());
        this.requestsPerMinute = getInt("REQUESTS_PER_MINUTE", 600);
        this.circuitFailureRateThreshold = getInt("CIRCUIT_FAILURE_RATE_THRESHOLD", 50);
        this.circuitOpenSeconds = getLong("CIRCUIT_OPEN_SECONDS", 30);

        validate();
    }

    /**
     * Load from the classpath resource and the process environment.
     */
    public static PriceClientSettings load() {
        var settings = new PriceClientSettings(loadProperties(), System.getenv());
        logger.info("Price client settings loaded: url={}, maxRetries={}, backoffBase={}ms, failFast={}",
            settings.quoteApiUrl, settings.maxRetries, settings.backoffBaseMs, settings.failFastOnRateLimit);
        return settings;
    }

    /**
     * Build settings from explicit properties only, ignoring the environment.
     */
    public static PriceClientSettings forTest(Properties properties) {
        return new PriceClientSettings(properties, Map.of());
    }

    private static Properties loadProperties() {
        var props = new Properties();
        try (InputStream in = PriceClientSettings.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                props.load(in);
                logger.debug("Loaded properties from {}", CONFIG_RESOURCE);
            } else {
                logger.debug("No {} on classpath, using defaults", CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
        }
        return props;
    }

    /**
     * Validate settings using Bean Validation.
     * Throws IllegalStateException if validation fails.
     */
    private void validate() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            var violations = factory.getValidator().validate(this);
            if (!violations.isEmpty()) {
                var errorMessages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
                throw new IllegalStateException(
                    "Price client settings validation failed: " + String.join(", ", errorMessages));
            }
        }
    }

    private String getString(String key, String defaultValue) {
        String value = environment.get(key);
        if (value == null || value.isBlank()) {
            value = properties.getProperty(key);
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    /**
     * Default per-call config derived from these settings.
     */
    public ClientConfig clientConfig() {
        return new ClientConfig(maxRetries, Duration.ofMillis(backoffBaseMs), failFastOnRateLimit,
            Duration.ofSeconds(defaultRateLimitWaitSeconds));
    }

    public String quoteApiUrl() {
        return quoteApiUrl;
    }

    public String requestType() {
        return requestType;
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public int requestsPerMinute() {
        return requestsPerMinute;
    }

    public int circuitFailureRateThreshold() {
        return circuitFailureRateThreshold;
    }

    public Duration circuitOpenDuration() {
        return Duration.ofSeconds(circuitOpenSeconds);
    }
}
