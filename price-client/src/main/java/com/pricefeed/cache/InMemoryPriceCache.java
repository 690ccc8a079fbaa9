package com.pricefeed.cache;

import com.pricefeed.model.PriceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-backed {@link PriceCache}. Entries live as long as the instance; there is
 * no expiry, so callers reading degraded results should check {@code observedAt}.
 *
 * Records are immutable and swapped whole under the map's per-key lock. A put
 * never replaces a record observed later than itself, which keeps a slow,
 * superseded fetch from overwriting a newer price.
 */
public class InMemoryPriceCache implements PriceCache {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryPriceCache.class);

    private final ConcurrentMap<String, PriceRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<PriceRecord> get(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        PriceRecord record = records.get(symbol);
        if (record != null && !record.symbol().equals(symbol)) {
            logger.error("🚨 Cache entry for {} holds a record for {} - ignoring it", symbol, record.symbol());
            return Optional.empty();
        }
        return Optional.ofNullable(record);
    }

    @Override
    public void put(PriceRecord record) {
        records.compute(record.symbol(), (symbol, current) -> {
            if (current != null && current.isNewerThan(record)) {
                logger.debug("Keeping newer cached price for {} ({} > {})",
                    symbol, current.observedAt(), record.observedAt());
                return current;
            }
            return record;
        });
    }

    @Override
    public void clear() {
        records.clear();
        logger.debug("Price cache cleared");
    }

    @Override
    public int size() {
        return records.size();
    }
}
