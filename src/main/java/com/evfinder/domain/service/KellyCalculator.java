package com.evfinder.domain.service;

import com.evfinder.domain.model.KellySizing;
import com.evfinder.domain.model.Money;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fractional Kelly stake sizing.
 */
public class KellyCalculator {

    private final StakingRules rules;

    public KellyCalculator(StakingRules rules) {
        this.rules = rules;
    }

    /**
     * Sizes a stake with the Kelly criterion {@code f* = (bp - q) / b}, scaled by the configured
     * multiplier and capped at the maximum stake percentage.
     *
     * @param odds        Decimal odds offered
     * @param fairProbPct Fair probability of the selection, in percent
     * @param bankroll    Bankroll the stake is taken from
     * @return The sizing; a zero stake when there is no edge or the stake is below the minimum
     */
    public KellySizing size(double odds, double fairProbPct, BigDecimal bankroll) {
        double p = fairProbPct / 100.0;
        double q = 1 - p;
        double b = odds - 1;

        if (b <= 0 || p <= 0) {
            return KellySizing.noEdge(rules.kellyMultiplier());
        }

        double kellyFull = (b * p - q) / b;
        if (kellyFull <= 0) {
            return KellySizing.noEdge(rules.kellyMultiplier());
        }

        double fraction = Math.min(kellyFull * rules.kellyMultiplier(), rules.maxStakePercent());
        BigDecimal stake = Money.round(bankroll.multiply(BigDecimal.valueOf(fraction)));
        if (stake.compareTo(rules.minStake()) < 0) {
            stake = Money.ZERO;
        }

        return new KellySizing(round6(kellyFull), round6(fraction), stake, rules.kellyMultiplier());
    }

    private static double round6(double value) {
        return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).doubleValue();
    }
}
