package com.pricefeed.cache;

import com.pricefeed.model.PriceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryPriceCache Tests")
class InMemoryPriceCacheTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryPriceCache cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryPriceCache();
    }

    private static PriceRecord record(String symbol, String price, Instant at) {
        return new PriceRecord(symbol, new BigDecimal(price), at);
    }

    @Test
    @DisplayName("Should return empty for unknown or null symbols")
    void shouldReturnEmptyForUnknownSymbol() {
        assertThat(cache.get("BTC")).isEmpty();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    @DisplayName("Should keep symbols isolated")
    void shouldIsolateSymbols() {
        cache.put(record("BTC", "45000.0", T0));
        cache.put(record("ETH", "3000.0", T0));

        assertThat(cache.get("BTC")).get().extracting(PriceRecord::price).isEqualTo(new BigDecimal("45000.0"));
        assertThat(cache.get("ETH")).get().extracting(PriceRecord::price).isEqualTo(new BigDecimal("3000.0"));
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Later observation replaces earlier one")
    void shouldReplaceWithNewerRecord() {
        cache.put(record("BTC", "45000.0", T0));
        cache.put(record("BTC", "46000.0", T0.plusSeconds(1)));

        assertThat(cache.get("BTC")).get().extracting(PriceRecord::price).isEqualTo(new BigDecimal("46000.0"));
    }

    @Test
    @DisplayName("A superseded record never overwrites a newer one")
    void shouldKeepNewerRecordOnLateWrite() {
        cache.put(record("BTC", "46000.0", T0.plusSeconds(5)));
        cache.put(record("BTC", "45000.0", T0));

        assertThat(cache.get("BTC")).get().extracting(PriceRecord::price).isEqualTo(new BigDecimal("46000.0"));
    }

    @Test
    @DisplayName("Equal observation times resolve to the last write")
    void shouldApplyLastWriteOnTie() {
        cache.put(record("BTC", "45000.0", T0));
        cache.put(record("BTC", "45001.0", T0));

        assertThat(cache.get("BTC")).get().extracting(PriceRecord::price).isEqualTo(new BigDecimal("45001.0"));
    }

    @Test
    @DisplayName("Repeated reads without a write return the same record")
    void shouldReturnSameRecordOnRepeatedReads() {
        cache.put(record("SOL", "100.0", T0));

        assertThat(cache.get("SOL")).isEqualTo(cache.get("SOL"));
    }

    @Test
    @DisplayName("Clear removes everything")
    void shouldClear() {
        cache.put(record("BTC", "45000.0", T0));
        cache.clear();

        assertThat(cache.get("BTC")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Concurrent writers on many symbols never cross-contaminate")
    void shouldStayIsolatedUnderConcurrency() throws Exception {
        List<String> symbols = List.of("BTC", "ETH", "SOL", "AVAX", "DOGE", "ARB", "OP", "LINK");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < symbols.size(); i++) {
                String symbol = symbols.get(i);
                int base = (i + 1) * 1000;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int n = 1; n <= 500; n++) {
                        cache.put(record(symbol, String.valueOf(base + n), T0.plusMillis(n)));
                        PriceRecord read = cache.get(symbol).orElseThrow();
                        assertThat(read.symbol()).isEqualTo(symbol);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < symbols.size(); i++) {
            PriceRecord last = cache.get(symbols.get(i)).orElseThrow();
            assertThat(last.symbol()).isEqualTo(symbols.get(i));
            assertThat(last.price()).isEqualByComparingTo(String.valueOf((i + 1) * 1000 + 500));
        }
    }
}
