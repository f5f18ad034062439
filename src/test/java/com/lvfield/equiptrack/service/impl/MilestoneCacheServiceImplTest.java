package com.lvfield.equiptrack.service.impl;

import com.lvfield.equiptrack.dto.milestone.CacheStats;
import com.lvfield.equiptrack.dto.milestone.MilestonePercentageBundle;
import com.lvfield.equiptrack.event.MilestonesRefreshedEvent;
import com.lvfield.equiptrack.exception.MilestoneCalculationException;
import com.lvfield.equiptrack.service.MilestoneCalculationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MilestoneCacheServiceImpl Tests")
class MilestoneCacheServiceImplTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);

    private FakeCalculator calculator;
    private MutableClock clock;
    private List<Object> events;
    private MilestoneCacheServiceImpl cache;

    @BeforeEach
    void setUp() {
        calculator = new FakeCalculator();
        clock = new MutableClock();
        events = new ArrayList<>();
        cache = new MilestoneCacheServiceImpl(calculator, events::add, clock, WINDOW);
    }

    @Test
    @DisplayName("Should compute on first read, cache the result and publish an event")
    void testRead_MissComputesAndCaches() {
        MilestonePercentageBundle bundle = cache.read(1).join();

        assertEquals(1, calculator.calls.get());
        assertEquals(1, bundle.getPlanning());
        assertTrue(cache.get(1).isPresent());
        assertEquals(clock.instant(), cache.get(1).get().getComputedAt());
        assertEquals(1, events.size());
        MilestonesRefreshedEvent event = (MilestonesRefreshedEvent) events.get(0);
        assertEquals(1, event.getProjectId());
        assertSame(bundle, event.getBundle());
    }

    @Test
    @DisplayName("Fresh entry is returned without recomputing")
    void testRead_FreshHit() {
        cache.read(1).join();
        clock.advance(Duration.ofMinutes(4));

        MilestonePercentageBundle bundle = cache.read(1).join();

        assertEquals(1, calculator.calls.get());
        assertEquals(1, bundle.getPlanning());
    }

    @Test
    @DisplayName("Stale entry is returned immediately while one background refresh runs")
    void testRead_StaleWhileRevalidate() {
        cache.read(1).join();
        clock.advance(Duration.ofMinutes(6));
        calculator.manual = true;

        MilestonePercentageBundle first = cache.read(1).join();
        MilestonePercentageBundle second = cache.read(1).join();

        assertEquals(1, first.getPlanning());
        assertEquals(1, second.getPlanning());
        assertEquals(2, calculator.calls.get());

        calculator.completeNext(1);
        assertEquals(2, cache.get(1).get().getBundle().getPlanning());
        assertTrue(cache.get(1).get().isFresh(clock.instant(), WINDOW));
    }

    @Test
    @DisplayName("Concurrent reads of a missing project share one computation")
    void testRead_InFlightShared() {
        calculator.manual = true;

        CompletableFuture<MilestonePercentageBundle> a = cache.read(1);
        CompletableFuture<MilestonePercentageBundle> b = cache.read(1);
        assertFalse(a.isDone());
        assertEquals(1, calculator.calls.get());

        calculator.completeNext(1);
        assertEquals(1, a.join().getPlanning());
        assertSame(a.join(), b.join());
    }

    @Test
    @DisplayName("After invalidate the next read triggers exactly one recomputation")
    void testInvalidate_NextReadRecomputes() {
        cache.read(1).join();
        cache.invalidate(1);
        assertFalse(cache.get(1).isPresent());

        MilestonePercentageBundle bundle = cache.read(1).join();

        assertEquals(2, calculator.calls.get());
        assertEquals(2, bundle.getPlanning());
        cache.read(1).join();
        assertEquals(2, calculator.calls.get());
    }

    @Test
    @DisplayName("A computation started before invalidate does not repopulate the cache")
    void testInvalidate_DuringComputation() {
        calculator.manual = true;
        CompletableFuture<MilestonePercentageBundle> inFlight = cache.read(1);

        cache.invalidate(1);
        calculator.completeNext(1);

        assertEquals(1, inFlight.join().getPlanning());
        assertFalse(cache.get(1).isPresent());
        assertTrue(events.isEmpty());

        CompletableFuture<MilestonePercentageBundle> next = cache.read(1);
        assertEquals(2, calculator.calls.get());
        calculator.completeNext(1);
        assertEquals(2, next.join().getPlanning());
        assertTrue(cache.get(1).isPresent());
    }

    @Test
    @DisplayName("Invalidate racing with the write-back of an older computation wins")
    void testInvalidate_RacesWithWriteBack() {
        calculator.manual = true;
        CompletableFuture<MilestonePercentageBundle> inFlight = cache.read(1);
        clock.onNextInstant = () -> cache.invalidate(1);

        calculator.completeNext(1);

        assertEquals(1, inFlight.join().getPlanning());
        assertFalse(cache.get(1).isPresent());
        assertTrue(events.isEmpty());

        CompletableFuture<MilestonePercentageBundle> next = cache.read(1);
        assertEquals(2, calculator.calls.get());
        calculator.completeNext(1);
        assertEquals(2, next.join().getPlanning());
        assertEquals(2, cache.get(1).get().getBundle().getPlanning());
    }

    @Test
    @DisplayName("Calculation errors are propagated and never cached")
    void testRead_ErrorNotCached() {
        calculator.failNext = new MilestoneCalculationException(1, "database down", null);

        CompletionException error = assertThrows(CompletionException.class, () -> cache.read(1).join());
        assertTrue(error.getCause() instanceof MilestoneCalculationException);
        assertFalse(cache.get(1).isPresent());

        MilestonePercentageBundle bundle = cache.read(1).join();
        assertEquals(2, bundle.getPlanning());
        assertTrue(cache.get(1).isPresent());
    }

    @Test
    @DisplayName("Invalidation is scoped to one project")
    void testInvalidate_NoCrossProject() {
        cache.read(1).join();
        cache.read(2).join();

        cache.invalidate(1);

        assertFalse(cache.get(1).isPresent());
        assertTrue(cache.get(2).isPresent());
    }

    @Test
    @DisplayName("readAll returns every project in request order")
    void testReadAll() {
        cache.read(2).join();

        Map<Integer, MilestonePercentageBundle> result = cache.readAll(List.of(3, 2, 1)).join();

        assertEquals(List.of(3, 2, 1), new ArrayList<>(result.keySet()));
        assertEquals(3, result.get(3).getProjectId());
        assertEquals(3, calculator.calls.get());
    }

    @Test
    @DisplayName("Stats and needsRefresh reflect freshness")
    void testStatsAndNeedsRefresh() {
        cache.read(1).join();
        clock.advance(Duration.ofMinutes(6));
        cache.set(2, MilestonePercentageBundle.builder().projectId(2).build());

        CacheStats stats = cache.stats();
        assertEquals(2, stats.getTotal());
        assertEquals(1, stats.getFresh());
        assertEquals(1, stats.getStale());
        assertEquals(WINDOW.toMillis(), stats.getFreshnessWindowMillis());

        assertEquals(List.of(1, 3), cache.needsRefresh(List.of(1, 2, 3)));

        cache.invalidateAll(List.of(1, 2));
        assertEquals(0, cache.stats().getTotal());
    }

    private static final class FakeCalculator implements MilestoneCalculationService {

        private final AtomicInteger calls = new AtomicInteger();
        private final Deque<CompletableFuture<MilestonePercentageBundle>> pending = new ArrayDeque<>();
        private final Deque<Integer> pendingVersions = new ArrayDeque<>();
        private boolean manual;
        private RuntimeException failNext;

        @Override
        public MilestonePercentageBundle compute(Integer projectId) {
            return computeAsync(projectId).join();
        }

        @Override
        public CompletableFuture<MilestonePercentageBundle> computeAsync(Integer projectId) {
            int version = calls.incrementAndGet();
            if (failNext != null) {
                RuntimeException failure = failNext;
                failNext = null;
                return CompletableFuture.failedFuture(failure);
            }
            if (manual) {
                CompletableFuture<MilestonePercentageBundle> future = new CompletableFuture<>();
                pending.add(future);
                pendingVersions.add(version);
                return future;
            }
            return CompletableFuture.completedFuture(bundle(projectId, version));
        }

        private void completeNext(Integer projectId) {
            pending.poll().complete(bundle(projectId, pendingVersions.poll()));
        }

        private static MilestonePercentageBundle bundle(Integer projectId, int version) {
            return MilestonePercentageBundle.builder().projectId(projectId).planning(version).build();
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now = Instant.parse("2026-01-01T08:00:00Z");
        private Runnable onNextInstant;

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Runnable hook = onNextInstant;
            if (hook != null) {
                onNextInstant = null;
                hook.run();
            }
            return now;
        }
    }
}
