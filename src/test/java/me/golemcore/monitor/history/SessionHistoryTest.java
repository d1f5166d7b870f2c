package me.golemcore.monitor.history;

import me.golemcore.monitor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionHistoryTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");
    private static final Duration WINDOW = Duration.ofHours(1);
    private static final long USER = 7L;

    private MutableClock clock;
    private SessionHistory history;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        history = new SessionHistory(5, WINDOW, clock);
    }

    // ===== addMessage / getHistory =====

    @Test
    void shouldReturnExchangesOldestFirst() {
        history.addMessage(USER, "a", "1");
        clock.advance(Duration.ofSeconds(1));
        history.addMessage(USER, "b", "2");

        List<Exchange> result = history.getHistory(USER);

        assertEquals(2, result.size());
        assertEquals(new Exchange("a", "1", T0), result.get(0));
        assertEquals(new Exchange("b", "2", T0.plusSeconds(1)), result.get(1));
    }

    @Test
    void shouldKeepOnlyLastMaxMessages() {
        SessionHistory small = new SessionHistory(2, WINDOW, clock);

        small.addMessage(USER, "a", "1");
        small.addMessage(USER, "b", "2");
        small.addMessage(USER, "c", "3");

        List<Exchange> result = small.getHistory(USER);
        assertEquals(List.of("b", "c"), result.stream().map(Exchange::query).toList());
        assertEquals(List.of("2", "3"), result.stream().map(Exchange::response).toList());
    }

    @Test
    void shouldNeverExceedMaxMessages() {
        for (int i = 0; i < 20; i++) {
            history.addMessage(USER, "q" + i, "r" + i);
            assertTrue(history.getHistory(USER).size() <= 5);
        }
        assertEquals("q15", history.getHistory(USER).get(0).query());
    }

    @Test
    void shouldReturnEmptyListForUnknownUser() {
        assertTrue(history.getHistory(42L).isEmpty());
        assertEquals(0, history.userCount());
    }

    @Test
    void shouldIsolateUsers() {
        history.addMessage(1L, "one", "r1");
        history.addMessage(2L, "two", "r2");

        assertEquals("one", history.getHistory(1L).get(0).query());
        assertEquals("two", history.getHistory(2L).get(0).query());
        assertEquals(2, history.userCount());
    }

    @Test
    void shouldNotChangeSnapshotAfterLaterWrites() {
        history.addMessage(USER, "a", "1");
        List<Exchange> snapshot = history.getHistory(USER);

        history.addMessage(USER, "b", "2");
        history.clearHistory(USER);

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, snapshot::clear);
    }

    // ===== expiry =====

    @Test
    void shouldExpireExchangesOutsideWindowAndDropUser() {
        history.addMessage(3L, "q", "r");

        clock.advance(Duration.ofMinutes(59));
        assertEquals(1, history.getHistory(3L).size());

        clock.advance(Duration.ofMinutes(2));
        assertTrue(history.getHistory(3L).isEmpty());
        assertEquals(0, history.userCount());
    }

    @Test
    void shouldKeepExchangeExactlyAtWindowEdge() {
        history.addMessage(USER, "q", "r");
        clock.advance(WINDOW);

        assertEquals(1, history.getHistory(USER).size());
    }

    @Test
    void shouldPruneExpiredBeforeAppending() {
        history.addMessage(USER, "old", "r");
        clock.advance(Duration.ofMinutes(90));
        history.addMessage(USER, "new", "r");

        List<Exchange> result = history.getHistory(USER);
        assertEquals(1, result.size());
        assertEquals("new", result.get(0).query());
    }

    @Test
    void shouldDropOnlyExpiredPartOfHistory() {
        history.addMessage(USER, "first", "r");
        clock.advance(Duration.ofMinutes(40));
        history.addMessage(USER, "second", "r");
        clock.advance(Duration.ofMinutes(30));

        assertEquals(List.of("second"), history.getHistory(USER).stream().map(Exchange::query).toList());
    }

    // ===== cleanupAll / clearHistory =====

    @Test
    void shouldRemoveIdleUsersOnCleanupAll() {
        history.addMessage(1L, "stale", "r");
        clock.advance(Duration.ofMinutes(50));
        history.addMessage(2L, "fresh", "r");
        clock.advance(Duration.ofMinutes(20));

        history.cleanupAll();

        assertEquals(1, history.userCount());
        assertTrue(history.getHistory(1L).isEmpty());
        assertEquals(1, history.getHistory(2L).size());
    }

    @Test
    void shouldClearHistoryIdempotently() {
        history.addMessage(USER, "q", "r");

        history.clearHistory(USER);
        assertTrue(history.getHistory(USER).isEmpty());
        assertEquals(0, history.userCount());

        history.clearHistory(USER);
        assertTrue(history.getHistory(USER).isEmpty());
        assertEquals(0, history.userCount());
    }

    // ===== construction =====

    @Test
    void shouldRejectInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new SessionHistory(0, WINDOW, clock));
        assertThrows(IllegalArgumentException.class, () -> new SessionHistory(5, Duration.ZERO, clock));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionHistory(5, Duration.ofMinutes(-5), clock));
    }

    // ===== concurrency =====

    @Test
    void shouldKeepMaxMessagesDistinctExchangesUnderConcurrentAdds() throws Exception {
        List<Exchange> result = addConcurrently(history, 50);

        assertEquals(5, result.size());
        assertEquals(5, distinctQueries(result).size());
        result.forEach(exchange -> assertEquals("r-" + exchange.query(), exchange.response()));
    }

    @Test
    void shouldNotLoseOrDuplicateConcurrentAdds() throws Exception {
        SessionHistory large = new SessionHistory(100, WINDOW, clock);

        List<Exchange> result = addConcurrently(large, 50);

        assertEquals(50, result.size());
        assertEquals(50, distinctQueries(result).size());
    }

    @Test
    void shouldKeepTimestampsInArrivalOrderUnderConcurrentAdds() throws Exception {
        SessionHistory large = new SessionHistory(100, WINDOW, clock);
        Thread ticker = new Thread(() -> {
            for (int i = 0; i < 1000; i++) {
                clock.advance(Duration.ofMillis(1));
            }
        });
        ticker.start();

        List<Exchange> result = addConcurrently(large, 50);
        ticker.join();

        for (int i = 1; i < result.size(); i++) {
            assertFalse(result.get(i).timestamp().isBefore(result.get(i - 1).timestamp()));
        }
    }

    @Test
    void shouldOnlyExposeSnapshotsThatArePrefixesOfArrivalOrder() throws Exception {
        SessionHistory large = new SessionHistory(1000, WINDOW, clock);
        int writers = 4;
        int addsPerWriter = 200;
        int readers = 4;
        int readsPerReader = 500;
        ExecutorService executor = Executors.newFixedThreadPool(writers + readers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers + readers);
        ConcurrentLinkedQueue<List<Exchange>> snapshots = new ConcurrentLinkedQueue<>();
        AtomicInteger malformed = new AtomicInteger();

        for (int w = 0; w < writers; w++) {
            int writer = w;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < addsPerWriter; i++) {
                        large.addMessage(USER, "w" + writer + "-" + i, "r");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        for (int r = 0; r < readers; r++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < readsPerReader; i++) {
                        List<Exchange> snapshot = large.getHistory(USER);
                        if (snapshot.stream().anyMatch(Objects::isNull)
                                || distinctQueries(snapshot).size() != snapshot.size()) {
                            malformed.incrementAndGet();
                        }
                        snapshots.add(snapshot);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(20, TimeUnit.SECONDS));
        executor.shutdown();

        List<Exchange> finalHistory = large.getHistory(USER);
        assertEquals(writers * addsPerWriter, finalHistory.size());
        assertEquals(writers * addsPerWriter, distinctQueries(finalHistory).size());
        assertEquals(0, malformed.get());
        for (List<Exchange> snapshot : snapshots) {
            assertEquals(finalHistory.subList(0, snapshot.size()), snapshot);
        }
    }

    private List<Exchange> addConcurrently(SessionHistory target, int calls) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(calls);

        for (int i = 0; i < calls; i++) {
            String query = "q" + i;
            executor.submit(() -> {
                try {
                    start.await();
                    target.addMessage(USER, query, "r-" + query);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        return target.getHistory(USER);
    }

    private static Set<String> distinctQueries(List<Exchange> exchanges) {
        Set<String> queries = new HashSet<>();
        exchanges.forEach(exchange -> queries.add(exchange.query()));
        return queries;
    }
}
