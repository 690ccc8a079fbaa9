package com.pricefeed.retry;

import com.pricefeed.error.ErrorKind;
import com.pricefeed.error.FetchFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RetryController Tests")
class RetryControllerTest {

    private static final Duration BASE = Duration.ofMillis(300);

    private RecordingSleeper sleeper;
    private RetryController retryController;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        retryController = new RetryController(sleeper);
    }

    @Nested
    @DisplayName("Retry bound")
    class RetryBoundTests {

        @Test
        @DisplayName("Persistent transient failure runs exactly maxRetries + 1 attempts")
        void shouldStopAfterMaxRetriesPlusOne() {
            var calls = new AtomicInteger();

            assertThatThrownBy(() -> retryController.execute("fetch BTC", () -> {
                calls.incrementAndGet();
                throw FetchFailure.of(ErrorKind.TRANSIENT, "HTTP 500");
            }, 3, BASE))
                .isInstanceOf(FetchFailure.class)
                .hasMessage("HTTP 500");

            assertThat(calls).hasValue(4);
        }

        @Test
        @DisplayName("maxRetries = 0 means a single attempt and no sleep")
        void shouldNotRetryWhenMaxRetriesIsZero() {
            var calls = new AtomicInteger();

            assertThatThrownBy(() -> retryController.execute("fetch BTC", () -> {
                calls.incrementAndGet();
                throw FetchFailure.of(ErrorKind.TRANSIENT, "timeout");
            }, 0, BASE)).isInstanceOf(FetchFailure.class);

            assertThat(calls).hasValue(1);
            assertThat(sleeper.sleeps()).isEmpty();
        }

        @Test
        @DisplayName("Surfaces the last failure, not the first")
        void shouldRethrowLastFailure() {
            var calls = new AtomicInteger();

            assertThatThrownBy(() -> retryController.execute("fetch BTC", () -> {
                throw FetchFailure.of(ErrorKind.TRANSIENT, "failure #" + calls.incrementAndGet());
            }, 2, BASE))
                .hasMessage("failure #3");
        }

        @Test
        @DisplayName("Incomplete failures are retried like transient ones")
        void shouldRetryIncompleteFailures() throws Exception {
            var calls = new AtomicInteger();

            String result = retryController.execute("fetch BTC", () -> {
                if (calls.incrementAndGet() < 2) {
                    throw FetchFailure.of(ErrorKind.INCOMPLETE, "price missing");
                }
                return "ok";
            }, 3, BASE);

            assertThat(result).isEqualTo("ok");
            assertThat(calls).hasValue(2);
        }
    }

    @Nested
    @DisplayName("Backoff")
    class BackoffTests {

        @Test
        @DisplayName("Sleeps base * 2^attemptIndex between attempts")
        void shouldBackOffExponentially() {
            assertThatThrownBy(() -> retryController.execute("fetch ETH", () -> {
                throw FetchFailure.of(ErrorKind.TRANSIENT, "HTTP 503");
            }, 3, BASE)).isInstanceOf(FetchFailure.class);

            assertThat(sleeper.sleeps()).containsExactly(
                Duration.ofMillis(300), Duration.ofMillis(600), Duration.ofMillis(1200));
        }

        @Test
        @DisplayName("No sleep after the first attempt succeeds")
        void shouldNotSleepOnImmediateSuccess() throws Exception {
            Integer result = retryController.execute("fetch ETH", () -> 42, 3, BASE);

            assertThat(result).isEqualTo(42);
            assertThat(sleeper.sleeps()).isEmpty();
        }

        @Test
        @DisplayName("Backoff exponent is capped")
        void shouldCapBackoffExponent() {
            assertThat(RetryController.backoffFor(Duration.ofMillis(1), 100))
                .isEqualTo(Duration.ofMillis(1L << 30));
        }
    }

    @Nested
    @DisplayName("Non-retryable failures")
    class NonRetryableTests {

        @Test
        @DisplayName("Data integrity failure aborts immediately without backoff")
        void shouldAbortOnDataIntegrity() {
            var calls = new AtomicInteger();

            assertThatThrownBy(() -> retryController.execute("fetch BTC", () -> {
                calls.incrementAndGet();
                throw FetchFailure.of(ErrorKind.DATA_INTEGRITY, "negative price");
            }, 5, BASE))
                .isInstanceOfSatisfying(FetchFailure.class,
                    f -> assertThat(f.getKind()).isEqualTo(ErrorKind.DATA_INTEGRITY));

            assertThat(calls).hasValue(1);
            assertThat(sleeper.sleeps()).isEmpty();
        }

        @Test
        @DisplayName("Rate-limited failure is not retried by the backoff loop")
        void shouldAbortOnRateLimited() {
            var calls = new AtomicInteger();

            assertThatThrownBy(() -> retryController.execute("fetch BTC", () -> {
                calls.incrementAndGet();
                throw FetchFailure.of(ErrorKind.RATE_LIMITED, "429");
            }, 5, BASE)).isInstanceOf(FetchFailure.class);

            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("Transient then data integrity stops at the data integrity failure")
        void shouldStopWhenFailureTurnsNonRetryable() {
            var calls = new AtomicInteger();

            assertThatThrownBy(() -> retryController.execute("fetch BTC", () -> {
                if (calls.incrementAndGet() == 1) {
                    throw FetchFailure.of(ErrorKind.TRANSIENT, "HTTP 502");
                }
                throw FetchFailure.of(ErrorKind.DATA_INTEGRITY, "symbol mismatch");
            }, 5, BASE)).hasMessage("symbol mismatch");

            assertThat(calls).hasValue(2);
            assertThat(sleeper.sleeps()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Interruption during backoff propagates and stops retrying")
    void shouldPropagateInterruption() {
        var calls = new AtomicInteger();
        var interruptingController = new RetryController(duration -> {
            throw new InterruptedException("cancelled");
        });

        assertThatThrownBy(() -> interruptingController.execute("fetch BTC", () -> {
            calls.incrementAndGet();
            throw FetchFailure.of(ErrorKind.TRANSIENT, "timeout");
        }, 3, BASE)).isInstanceOf(InterruptedException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Should reject negative maxRetries")
    void shouldRejectNegativeMaxRetries() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> retryController.execute("fetch BTC", () -> "x", -1, BASE));
    }
}
