package com.evfinder.application.usecase;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.domain.model.BankrollSummary;
import com.evfinder.domain.service.BankrollSummaryProjection;
import com.evfinder.domain.service.StakingRules;
import com.evfinder.infrastructure.persistence.JsonFileLedgerRepository;
import com.evfinder.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;

import static com.evfinder.testing.Fixtures.NOW;
import static com.evfinder.testing.Fixtures.pendingBet;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BankrollSummaryUseCase.
 */
class BankrollSummaryUseCaseTest {

    @TempDir
    Path tempDir;

    private LedgerStore ledgerStore;
    private BankrollSummaryUseCase useCase;

    @BeforeEach
    void setUp() {
        ledgerStore = new LedgerStore(new JsonFileLedgerRepository(tempDir.resolve("bankroll.json")),
            new MutableClock(NOW), new BigDecimal("100.00"));
        useCase = new BankrollSummaryUseCase(ledgerStore, new BankrollSummaryProjection(), StakingRules.defaults());
    }

    @Test
    void testSummaryOfNewLedger() {
        BankrollSummary summary = useCase.getSummary();

        assertEquals(new BigDecimal("100.00"), summary.currentBankroll());
        assertEquals(0, summary.totalBets());
    }

    @Test
    void testResetToAmount() {
        ledgerStore.update(ledger -> {
            ledger.addPendingBet(pendingBet("b1", "5.00", 2.0, NOW));
            return null;
        });

        BankrollSummary summary = useCase.reset(new BigDecimal("250"));

        assertEquals(new BigDecimal("250.00"), summary.initialBankroll());
        assertEquals(new BigDecimal("250.00"), summary.currentBankroll());
        assertEquals(0, summary.totalBets());
        assertTrue(ledgerStore.snapshot().getBets().isEmpty());
    }

    @Test
    void testResetToConfiguredDefault() {
        useCase.reset(new BigDecimal("40"));

        BankrollSummary summary = useCase.reset(null);

        assertEquals(new BigDecimal("100.00"), summary.initialBankroll());
    }

    @Test
    void testResetRejectsNonPositiveAmount() {
        assertThrows(IllegalArgumentException.class, () -> useCase.reset(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> useCase.reset(new BigDecimal("-10")));
    }
}
