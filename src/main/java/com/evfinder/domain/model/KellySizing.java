package com.evfinder.domain.model;

import java.math.BigDecimal;

/**
 * Result of fractional-Kelly sizing.
 *
 * @param kellyFull     full Kelly fraction of bankroll (0 when there is no edge)
 * @param kellyFraction fraction actually staked after the multiplier and the cap
 * @param stake         amount to stake, 0 when below the minimum stake
 * @param kellyUsed     Kelly multiplier that was applied
 */
public record KellySizing(double kellyFull, double kellyFraction, BigDecimal stake, double kellyUsed) {

    public static KellySizing noEdge(double kellyUsed) {
        return new KellySizing(0, 0, Money.ZERO, kellyUsed);
    }

    public boolean hasStake() {
        return stake.signum() > 0;
    }
}
