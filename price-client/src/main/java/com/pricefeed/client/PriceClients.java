package com.pricefeed.client;

import com.pricefeed.config.PriceClientSettings;
import com.pricefeed.transport.HttpQuoteTransport;
import com.pricefeed.transport.ResilientQuoteTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Wires a production {@link PriceClient}: HTTP transport behind a circuit
 * breaker and rate limiter, private in-memory cache, settings-derived defaults.
 */
public final class PriceClients {

    private PriceClients() {
    }

    public static PriceClient create() {
        return create(PriceClientSettings.load(), new SimpleMeterRegistry());
    }

    public static PriceClient create(PriceClientSettings settings, MeterRegistry meterRegistry) {
        var transport = new ResilientQuoteTransport(new HttpQuoteTransport(settings), settings);
        return new PriceClient(transport, settings.clientConfig(), meterRegistry);
    }
}
