package com.evfinder.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the ledger for presentation.
 *
 * @param winRate percentage of won bets among won + lost, one decimal
 * @param roi     total profit over stakes of won + lost bets, in percent, one decimal
 */
public record BankrollSummary(
    BigDecimal initialBankroll,
    BigDecimal currentBankroll,
    BigDecimal totalStaked,
    BigDecimal totalReturned,
    BigDecimal totalProfit,
    int totalBets,
    int pendingBets,
    int wonBets,
    int lostBets,
    int voidBets,
    double winRate,
    double roi,
    List<ProfitPoint> plHistory,
    List<Bet> recentBets,
    Instant createdAt
) {

    /**
     * Point of the cumulative profit curve, one per settled bet.
     */
    public record ProfitPoint(Instant timestamp, BigDecimal cumulativePl, BigDecimal bankroll, String betId) {
    }
}
