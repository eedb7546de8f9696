package com.evfinder.domain.service;

import java.math.BigDecimal;

/**
 * Bankroll management parameters.
 *
 * @param kellyMultiplier Fraction of the full Kelly stake actually used (0.25 = quarter Kelly)
 * @param maxStakePercent Cap on a single stake as a fraction of the bankroll
 * @param minStake        Stakes below this amount are not placed
 * @param minEvToBet      Minimum EV percentage for automatic placement
 * @param minBooksToBet   Minimum number of bookmakers behind the consensus
 * @param autoBet         Whether detected value bets are placed automatically
 * @param initialBankroll Bankroll of a fresh ledger
 */
public record StakingRules(
    double kellyMultiplier,
    double maxStakePercent,
    BigDecimal minStake,
    double minEvToBet,
    int minBooksToBet,
    boolean autoBet,
    BigDecimal initialBankroll
) {

    public static StakingRules defaults() {
        return new StakingRules(0.25, 0.05, new BigDecimal("0.10"), 1.0, 3, true, new BigDecimal("100.00"));
    }
}
