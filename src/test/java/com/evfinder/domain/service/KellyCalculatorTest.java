package com.evfinder.domain.service;

import com.evfinder.domain.model.KellySizing;
import com.evfinder.domain.model.Money;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for KellyCalculator.
 */
class KellyCalculatorTest {

    private static final BigDecimal BANKROLL = new BigDecimal("100.00");

    private final KellyCalculator calculator = new KellyCalculator(StakingRules.defaults());

    @Test
    void testQuarterKellyAtMaximum() {
        KellySizing sizing = calculator.size(2.0, 60.0, BANKROLL);

        assertEquals(0.2, sizing.kellyFull(), 1e-9);
        assertEquals(0.05, sizing.kellyFraction(), 1e-9);
        assertEquals(new BigDecimal("5.00"), sizing.stake());
        assertEquals(0.25, sizing.kellyUsed(), 1e-9);
        assertTrue(sizing.hasStake());
    }

    @Test
    void testStakeBelowCap() {
        KellySizing sizing = calculator.size(2.0, 54.0, BANKROLL);

        assertEquals(0.08, sizing.kellyFull(), 1e-9);
        assertEquals(0.02, sizing.kellyFraction(), 1e-9);
        assertEquals(new BigDecimal("2.00"), sizing.stake());
    }

    @Test
    void testFractionIsCapped() {
        KellySizing sizing = calculator.size(3.0, 60.0, BANKROLL);

        assertEquals(0.4, sizing.kellyFull(), 1e-9);
        assertEquals(0.05, sizing.kellyFraction(), 1e-9);
        assertEquals(new BigDecimal("5.00"), sizing.stake());
    }

    @Test
    void testNoEdgeGivesZeroStake() {
        KellySizing fair = calculator.size(2.0, 50.0, BANKROLL);
        KellySizing negative = calculator.size(1.8, 50.0, BANKROLL);

        assertEquals(Money.ZERO, fair.stake());
        assertEquals(0.0, fair.kellyFull());
        assertEquals(Money.ZERO, negative.stake());
        assertFalse(negative.hasStake());
    }

    @Test
    void testDegenerateInputs() {
        assertFalse(calculator.size(1.0, 60.0, BANKROLL).hasStake());
        assertFalse(calculator.size(0.5, 60.0, BANKROLL).hasStake());
        assertFalse(calculator.size(2.0, 0.0, BANKROLL).hasStake());
    }

    @Test
    void testStakeBelowMinimumIsZero() {
        KellySizing sizing = calculator.size(2.0, 51.0, new BigDecimal("1.00"));

        assertEquals(Money.ZERO, sizing.stake());
        assertTrue(sizing.kellyFraction() > 0);
    }

    @Test
    void testCustomRules() {
        StakingRules rules = new StakingRules(0.5, 0.10, new BigDecimal("1.00"), 1.0, 3, true,
            new BigDecimal("1000.00"));
        KellySizing sizing = new KellyCalculator(rules).size(2.0, 54.0, new BigDecimal("1000.00"));

        assertEquals(0.04, sizing.kellyFraction(), 1e-9);
        assertEquals(new BigDecimal("40.00"), sizing.stake());
        assertEquals(0.5, sizing.kellyUsed(), 1e-9);
    }
}
