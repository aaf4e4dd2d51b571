package devicefleet.controlplane.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import devicefleet.controlplane.config.AuthProperties;
import devicefleet.controlplane.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("NonceLedger Tests")
class NonceLedgerTest {

    private static final long NOW = 1_700_000_000L;

    private MutableClock clock;
    private NonceLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(NOW);
        ledger = new NonceLedger(new AuthProperties(), clock);
    }

    @Nested
    @DisplayName("checkAndStore")
    class CheckAndStoreTests {

        @Test
        @DisplayName("Should accept a nonce once and reject the replay")
        void shouldRejectReplay() {
            assertThat(ledger.checkAndStore("http", "n-1")).isTrue();
            assertThat(ledger.checkAndStore("http", "n-1")).isFalse();
        }

        @Test
        @DisplayName("Should keep namespaces apart")
        void shouldSeparateNamespaces() {
            assertThat(ledger.checkAndStore("http", "shared")).isTrue();
            assertThat(ledger.checkAndStore("ws", "shared")).isTrue();
            assertThat(ledger.checkAndStore("ws", "shared")).isFalse();
        }

        @Test
        @DisplayName("Should reject empty or missing nonces without storing them")
        void shouldRejectEmptyNonce() {
            assertThat(ledger.checkAndStore("http", "")).isFalse();
            assertThat(ledger.checkAndStore("http", null)).isFalse();
            assertThat(ledger.size()).isZero();
        }

        @Test
        @DisplayName("Should still reject a nonce exactly at the TTL boundary")
        void shouldRejectAtTtlBoundary() {
            ledger.checkAndStore("http", "edge");
            clock.advance(Duration.ofSeconds(120));

            assertThat(ledger.checkAndStore("http", "edge")).isFalse();
        }

        @Test
        @DisplayName("Should accept a nonce again once its record is older than the TTL")
        void shouldAcceptAfterTtl() {
            ledger.checkAndStore("http", "old");
            clock.advance(Duration.ofSeconds(121));

            assertThat(ledger.checkAndStore("http", "old")).isTrue();
            assertThat(ledger.checkAndStore("http", "old")).isFalse();
        }

        @Test
        @DisplayName("Should admit exactly one of many concurrent uses of the same nonce")
        void shouldAdmitOneConcurrentUse() throws Exception {
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return ledger.checkAndStore("http", "race");
                    }));
                }
                start.countDown();

                int accepted = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(5, TimeUnit.SECONDS)) {
                        accepted++;
                    }
                }
                assertThat(accepted).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("cleanupExpired")
    class CleanupTests {

        @Test
        @DisplayName("Should remove only records older than the TTL")
        void shouldRemoveExpiredRecords() {
            ledger.recordAt("http", "stale-1", NOW - 500);
            ledger.recordAt("ws", "stale-2", NOW - 121);
            ledger.recordAt("http", "fresh", NOW - 120);

            int removed = ledger.cleanupExpired(NOW);

            assertThat(removed).isEqualTo(2);
            assertThat(ledger.size()).isEqualTo(1);
            assertThat(ledger.checkAndStore("http", "fresh")).isFalse();
            assertThat(ledger.checkAndStore("ws", "stale-2")).isTrue();
        }

        @Test
        @DisplayName("Should use the injected clock when no reference time is given")
        void shouldUseClock() {
            ledger.checkAndStore("http", "a");
            clock.advance(Duration.ofMinutes(10));

            assertThat(ledger.cleanupExpired()).isEqualTo(1);
            assertThat(ledger.size()).isZero();
        }

        @Test
        @DisplayName("Should drop everything on clear")
        void shouldClear() {
            ledger.checkAndStore("http", "a");
            ledger.checkAndStore("ws", "b");

            ledger.clear();

            assertThat(ledger.size()).isZero();
            assertThat(ledger.checkAndStore("http", "a")).isTrue();
        }
    }

    @Test
    @DisplayName("Sweeper should survive a failing cleanup")
    void sweeperShouldSurviveFailures() {
        AuthProperties properties = new AuthProperties();
        NonceLedger failing = new NonceLedger(properties, clock) {
            @Override
            public int cleanupExpired() {
                throw new IllegalStateException("boom");
            }
        };
        NonceSweeper sweeper = new NonceSweeper(failing, properties);

        assertThatCode(sweeper::sweep).doesNotThrowAnyException();
        sweeper.stop();
    }

    @Test
    @DisplayName("Sweeper should remove expired records")
    void sweeperShouldRemoveExpired() {
        NonceSweeper sweeper = new NonceSweeper(ledger, new AuthProperties());
        ledger.recordAt("http", "stale", NOW - 1_000);

        sweeper.sweep();
        sweeper.stop();

        assertThat(ledger.size()).isZero();
    }
}
