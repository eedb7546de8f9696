package com.evfinder.application.state;

import com.evfinder.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.evfinder.testing.Fixtures.NOW;
import static com.evfinder.testing.Fixtures.valueBet;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RefreshState.
 */
class RefreshStateTest {

    private MutableClock clock;
    private RefreshState state;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        state = new RefreshState(clock);
    }

    @Test
    void testInitialState() {
        RefreshState.Snapshot snapshot = state.snapshot();

        assertEquals(RefreshStatus.IDLE, snapshot.status());
        assertNull(snapshot.lastUpdate());
        assertTrue(state.valueBets().isEmpty());
        assertTrue(state.isStale(Duration.ofMinutes(2)));
    }

    @Test
    void testOnlyOneRefreshAtATime() {
        assertTrue(state.tryBegin());
        assertFalse(state.tryBegin());
        assertTrue(state.isLoading());
        assertFalse(state.isStale(Duration.ofMinutes(2)));

        state.complete(List.of(), RefreshStats.empty());

        assertTrue(state.tryBegin());
    }

    @Test
    void testCompletePublishesResults() {
        state.tryBegin();
        state.progress(40);
        RefreshStats stats = new RefreshStats(1, 12, 20.0, Map.of("Football", 1), "Football");

        state.complete(List.of(valueBet("m1", "Arsenal", 2.0, 60.0, 20.0)), stats);

        RefreshState.Snapshot snapshot = state.snapshot();
        assertEquals(RefreshStatus.READY, snapshot.status());
        assertEquals(100, snapshot.progress());
        assertEquals(NOW, snapshot.lastUpdate());
        assertEquals(stats, snapshot.stats());
        assertEquals(1, state.valueBets().size());
    }

    @Test
    void testFailKeepsPreviousResults() {
        state.tryBegin();
        state.complete(List.of(valueBet("m1", "Arsenal", 2.0, 60.0, 20.0)), RefreshStats.empty());
        state.tryBegin();

        state.fail("feed down");

        RefreshState.Snapshot snapshot = state.snapshot();
        assertEquals(RefreshStatus.ERROR, snapshot.status());
        assertEquals("feed down", snapshot.error());
        assertEquals(1, state.valueBets().size());
        assertTrue(state.tryBegin());
        assertNull(state.snapshot().error());
    }

    @Test
    void testStaleness() {
        state.tryBegin();
        state.complete(List.of(), RefreshStats.empty());

        clock.advance(Duration.ofSeconds(60));
        assertFalse(state.isStale(Duration.ofSeconds(120)));

        clock.advance(Duration.ofSeconds(61));
        assertTrue(state.isStale(Duration.ofSeconds(120)));
    }

    @Test
    void testLogIsBounded() {
        for (int i = 0; i < RefreshState.MAX_LOGS + 5; i++) {
            state.log("line " + i);
        }

        List<RefreshState.LogEntry> logs = state.snapshot().logs();
        assertEquals(RefreshState.MAX_LOGS, logs.size());
        assertEquals("line 5", logs.get(0).msg());
        assertEquals("line " + (RefreshState.MAX_LOGS + 4), logs.get(logs.size() - 1).msg());
    }

    @Test
    void testProgressIsClamped() {
        state.progress(150);
        assertEquals(100, state.snapshot().progress());
        state.progress(-3);
        assertEquals(0, state.snapshot().progress());
    }
}
