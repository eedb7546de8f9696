package com.evfinder.application.usecase;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.application.state.RefreshState;
import com.evfinder.application.state.RefreshStats;
import com.evfinder.application.state.RefreshStatus;
import com.evfinder.domain.model.MarketEvent;
import com.evfinder.domain.model.MarketType;
import com.evfinder.domain.model.ReferenceEvent;
import com.evfinder.domain.model.ValueBet;
import com.evfinder.domain.ports.ReferenceOddsGateway;
import com.evfinder.domain.ports.TargetOddsGateway;
import com.evfinder.domain.service.BetResultEvaluator;
import com.evfinder.domain.service.EventMatcher;
import com.evfinder.domain.service.KellyCalculator;
import com.evfinder.domain.service.MarketKeywords;
import com.evfinder.domain.service.OddsNormalizer;
import com.evfinder.domain.service.SequenceMatcherSimilarity;
import com.evfinder.domain.service.StakingRules;
import com.evfinder.domain.service.ValueBetDetector;
import com.evfinder.infrastructure.persistence.JsonFileLedgerRepository;
import com.evfinder.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.evfinder.testing.Fixtures.NOW;
import static com.evfinder.testing.Fixtures.reference;
import static com.evfinder.testing.Fixtures.target;
import static com.evfinder.testing.Fixtures.valueBet;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RefreshValueBetsUseCase and ListValueBetsUseCase.
 */
class RefreshValueBetsUseCaseTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private RefreshState state;
    private LedgerStore ledgerStore;
    private FakeTargetGateway winamax;
    private FakeReferenceGateway consensus;
    private RefreshValueBetsUseCase useCase;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        state = new RefreshState(clock);
        ledgerStore = new LedgerStore(new JsonFileLedgerRepository(tempDir.resolve("bankroll.json")), clock,
            new BigDecimal("100.00"));
        winamax = new FakeTargetGateway("winamax");
        consensus = new FakeReferenceGateway();

        SequenceMatcherSimilarity similarity = new SequenceMatcherSimilarity();
        ValueBetDetector detector = new ValueBetDetector(new OddsNormalizer(), new EventMatcher(similarity), similarity,
            MarketKeywords.defaults());
        StakingRules rules = StakingRules.defaults();

        useCase = new RefreshValueBetsUseCase(
            List.of(winamax),
            consensus,
            new DetectValueBetsUseCase(detector, DetectionSettings.defaults()),
            new SettleBetsUseCase(ledgerStore, (matchId, home, away, start, sport) -> null,
                new BetResultEvaluator(MarketKeywords.defaults()), SettlementSettings.defaults(), clock),
            new PlaceBetsUseCase(ledgerStore, new KellyCalculator(rules), rules, clock),
            state,
            DetectionSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        useCase.shutdown();
    }

    @Test
    void testRefreshDetectsAndPlaces() {
        winamax.events.add(arsenalChelsea());
        consensus.bySport.put("soccer", List.of(arsenalChelseaReference()));

        assertTrue(useCase.execute());

        RefreshState.Snapshot snapshot = state.snapshot();
        assertEquals(RefreshStatus.READY, snapshot.status());
        assertEquals(100, snapshot.progress());
        assertEquals(1, state.valueBets().size());
        assertEquals("Arsenal", state.valueBets().get(0).betOn());
        assertEquals(1, snapshot.stats().totalBets());
        assertEquals(1, snapshot.stats().totalEvents());
        assertEquals("Football", snapshot.stats().topSport());
        assertEquals("h2h", consensus.lastMarketFilter);

        assertEquals(1, ledgerStore.snapshot().getBets().size());
        assertEquals(new BigDecimal("95.00"), ledgerStore.snapshot().getCurrentBankroll());
    }

    @Test
    void testSecondRefreshDoesNotPlaceAgain() {
        winamax.events.add(arsenalChelsea());
        consensus.bySport.put("soccer", List.of(arsenalChelseaReference()));

        useCase.execute();
        useCase.execute();

        assertEquals(1, ledgerStore.snapshot().getBets().size());
        assertEquals(1, state.valueBets().size());
    }

    @Test
    void testFailingProviderIsSkipped() {
        winamax.failure = new IOException("timeout");

        assertTrue(useCase.execute());

        RefreshState.Snapshot snapshot = state.snapshot();
        assertEquals(RefreshStatus.READY, snapshot.status());
        assertTrue(state.valueBets().isEmpty());
        assertTrue(snapshot.logs().stream().anyMatch(log -> log.msg().equals("winamax: fetch failed (timeout)")));
    }

    @Test
    void testFailingReferenceSkipsOnlyThatSport() {
        MarketEvent tennis = target("t1", "Nadal", "Federer", MarketType.H2H, null, "Nadal", 2.2, "Federer", 1.7);
        tennis.setSport("Tennis");
        tennis.setSportKey("tennis");
        winamax.events.add(tennis);
        winamax.events.add(arsenalChelsea());
        consensus.bySport.put("soccer", List.of(arsenalChelseaReference()));
        consensus.failingSport = "tennis";

        useCase.execute();

        assertEquals(RefreshStatus.READY, state.snapshot().status());
        assertEquals(1, state.valueBets().size());
        assertEquals("Football", state.valueBets().get(0).sport());
        assertTrue(state.snapshot().logs().stream()
            .anyMatch(log -> log.msg().startsWith("Tennis: reference lookup failed")));
    }

    @Test
    void testEventsWithoutSportKeyAreIgnored() {
        MarketEvent event = arsenalChelsea();
        event.setSportKey(" ");
        winamax.events.add(event);
        consensus.bySport.put("soccer", List.of(arsenalChelseaReference()));

        useCase.execute();

        assertTrue(state.valueBets().isEmpty());
        assertEquals(1, state.snapshot().stats().totalEvents());
    }

    @Test
    void testRefreshRefusedWhileRunning() {
        assertTrue(state.tryBegin());

        assertFalse(useCase.execute());
        assertFalse(useCase.startAsync());
    }

    @Test
    void testStartAfterShutdownMarksStateFailed() {
        useCase.shutdown();

        assertFalse(useCase.startAsync());

        RefreshState.Snapshot snapshot = state.snapshot();
        assertEquals(RefreshStatus.ERROR, snapshot.status());
        assertEquals("Refresh could not be scheduled", snapshot.error());
        assertTrue(state.tryBegin());
    }

    @Test
    void testFatalErrorDoesNotLeaveRefreshRunning() {
        winamax.events.add(arsenalChelsea());
        consensus.fatal = new OutOfMemoryError("Java heap space");

        assertThrows(OutOfMemoryError.class, () -> useCase.execute());

        RefreshState.Snapshot snapshot = state.snapshot();
        assertEquals(RefreshStatus.ERROR, snapshot.status());
        assertEquals("Refresh ended unexpectedly", snapshot.error());
        assertFalse(state.isLoading());
    }

    @Test
    void testListServesCurrentResultsWhenFresh() {
        winamax.events.add(arsenalChelsea());
        consensus.bySport.put("soccer", List.of(arsenalChelseaReference()));
        useCase.execute();
        int fetches = winamax.fetches;

        ListValueBetsUseCase list = new ListValueBetsUseCase(state, useCase);
        List<ValueBet> all = list.execute(ValueBetFilter.none());
        List<ValueBet> tennis = list.execute(new ValueBetFilter("Tennis", null, null, null));

        assertEquals(1, all.size());
        assertTrue(tennis.isEmpty());
        assertEquals(fetches, winamax.fetches);
        assertFalse(state.isStale(Duration.ofSeconds(120)));
    }

    @Test
    void testStats() {
        ValueBet first = valueBet("m1", "Arsenal", 2.0, 60.0, 20.0);
        ValueBet second = valueBet("m2", "Arsenal", 2.0, 55.0, 10.0);
        ValueBet third = new ValueBet("Tennis", "Nadal", "Federer", "h2h", MarketType.H2H, null, "Nadal", 2.2, 50.0,
            45.5, 10.01, "t1", NOW, 4);

        RefreshStats stats = RefreshValueBetsUseCase.stats(List.of(first, second, third), 40);

        assertEquals(3, stats.totalBets());
        assertEquals(40, stats.totalEvents());
        assertEquals(13.34, stats.avgEv(), 1e-9);
        assertEquals(Map.of("Football", 2, "Tennis", 1), stats.bySport());
        assertEquals("Football", stats.topSport());
        assertEquals("-", RefreshValueBetsUseCase.stats(List.of(), 0).topSport());
    }

    private static MarketEvent arsenalChelsea() {
        return target("m1", "Arsenal", "Chelsea", MarketType.H2H, null, "Arsenal", 2.0, "Draw", 3.4, "Chelsea", 4.0);
    }

    private static ReferenceEvent arsenalChelseaReference() {
        return reference("Arsenal", "Chelsea", MarketType.H2H, null, 5, "Arsenal", 1.6, "Draw", 4.0, "Chelsea", 6.0);
    }

    /**
     * Target gateway serving a fixed list.
     */
    private static class FakeTargetGateway implements TargetOddsGateway {

        private final String name;
        final List<MarketEvent> events = new ArrayList<>();
        Exception failure;
        int fetches;

        FakeTargetGateway(String name) {
            this.name = name;
        }

        @Override
        public String getProviderName() {
            return name;
        }

        @Override
        public List<MarketEvent> fetchTargetEvents() throws Exception {
            fetches++;
            if (failure != null) {
                throw failure;
            }
            return events;
        }
    }

    /**
     * Reference gateway serving events per sport key.
     */
    private static class FakeReferenceGateway implements ReferenceOddsGateway {

        final Map<String, List<ReferenceEvent>> bySport = new HashMap<>();
        String failingSport;
        Error fatal;
        String lastMarketFilter;

        @Override
        public List<ReferenceEvent> fetchReferenceEvents(String sportKey, String marketFilter) throws Exception {
            lastMarketFilter = marketFilter;
            if (fatal != null) {
                throw fatal;
            }
            if (sportKey.equals(failingSport)) {
                throw new IOException("HTTP 503");
            }
            return bySport.getOrDefault(sportKey, List.of());
        }
    }
}
