package com.evfinder.infrastructure.rest;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.application.usecase.BankrollSummaryUseCase;
import com.evfinder.application.usecase.SettleBetManuallyUseCase;
import com.evfinder.application.usecase.SettleBetsUseCase;
import com.evfinder.application.usecase.SettlementSettings;
import com.evfinder.domain.model.BankrollSummary;
import com.evfinder.domain.model.ManualSettlementResult;
import com.evfinder.domain.model.MatchResult;
import com.evfinder.domain.model.SettlementResult;
import com.evfinder.domain.service.BankrollSummaryProjection;
import com.evfinder.domain.service.BetResultEvaluator;
import com.evfinder.domain.service.MarketKeywords;
import com.evfinder.domain.service.StakingRules;
import com.evfinder.infrastructure.persistence.JsonFileLedgerRepository;
import com.evfinder.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;

import static com.evfinder.testing.Fixtures.NOW;
import static com.evfinder.testing.Fixtures.pendingBet;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BankrollController.
 */
class BankrollControllerTest {

    @TempDir
    Path tempDir;

    private LedgerStore ledgerStore;
    private BankrollController controller;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        ledgerStore = new LedgerStore(new JsonFileLedgerRepository(tempDir.resolve("bankroll.json")), clock,
            new BigDecimal("100.00"));
        BankrollSummaryProjection projection = new BankrollSummaryProjection();

        controller = new BankrollController(
            new BankrollSummaryUseCase(ledgerStore, projection, StakingRules.defaults()),
            new SettleBetsUseCase(ledgerStore, (matchId, home, away, start, sport) -> MatchResult.cancelled(home, away),
                new BetResultEvaluator(MarketKeywords.defaults()), SettlementSettings.defaults(), clock),
            new SettleBetManuallyUseCase(ledgerStore, projection, clock));

        ledgerStore.update(ledger -> {
            ledger.addPendingBet(pendingBet("b1", "5.00", 2.0, NOW.minus(Duration.ofHours(4))));
            ledger.addPendingBet(pendingBet("b2", "5.00", 2.0, NOW.plus(Duration.ofHours(4))));
            return null;
        });
    }

    @Test
    void testSummary() {
        BankrollSummary summary = controller.summary();

        assertEquals(2, summary.pendingBets());
        assertEquals(new BigDecimal("90.00"), summary.currentBankroll());
    }

    @Test
    void testSettleReportsEveryPendingBet() {
        SettlementResult result = controller.settle();

        assertEquals(1, result.settled());
        assertEquals(1, result.stillPending());
        assertEquals(2, result.betReports().size());
        assertEquals(new BigDecimal("95.00"), controller.summary().currentBankroll());
    }

    @Test
    void testSettleManual() {
        ResponseEntity<ManualSettlementResult> response = controller.settleManual(
            new BankrollController.ManualSettlementRequest("b2", "won", "1-0"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().success());
        assertEquals(new BigDecimal("100.00"), response.getBody().summary().currentBankroll());
    }

    @Test
    void testSettleManualRequiresFields() {
        ResponseEntity<ManualSettlementResult> missingResult = controller.settleManual(
            new BankrollController.ManualSettlementRequest("b2", " ", null));
        ResponseEntity<ManualSettlementResult> noBody = controller.settleManual(null);

        assertEquals(HttpStatus.BAD_REQUEST, missingResult.getStatusCode());
        assertFalse(missingResult.getBody().success());
        assertEquals(HttpStatus.BAD_REQUEST, noBody.getStatusCode());
    }

    @Test
    void testSettleManualRefusalIsStillOk() {
        ResponseEntity<ManualSettlementResult> response = controller.settleManual(
            new BankrollController.ManualSettlementRequest("zz", "won", null));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertFalse(response.getBody().success());
        assertEquals("Bet zz not found", response.getBody().message());
    }

    @Test
    void testReset() {
        BankrollController.ResetResponse withAmount = controller.reset(new BankrollController.ResetRequest(new BigDecimal("50")));
        assertEquals(new BigDecimal("50.00"), withAmount.summary().currentBankroll());
        assertEquals(0, withAmount.summary().totalBets());

        BankrollController.ResetResponse withDefault = controller.reset(null);
        assertEquals(new BigDecimal("100.00"), withDefault.summary().initialBankroll());
    }

    @Test
    void testResetRejectsNegativeAmount() {
        assertThrows(IllegalArgumentException.class,
            () -> controller.reset(new BankrollController.ResetRequest(new BigDecimal("-5"))));
        assertEquals(2, controller.summary().totalBets());
    }
}
