package com.pricefeed.cache;

import com.pricefeed.model.PriceRecord;

import java.util.Optional;

/**
 * Per-symbol store of last-known-good prices.
 *
 * Implementations must be safe for concurrent use, keep symbols isolated from
 * each other, and never let a reader observe a partially written record.
 * Concurrent writes for one symbol resolve by completion order.
 */
public interface PriceCache {

    Optional<PriceRecord> get(String symbol);

    void put(PriceRecord record);

    void clear();

    int size();
}
