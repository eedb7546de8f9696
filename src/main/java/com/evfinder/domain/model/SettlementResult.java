package com.evfinder.domain.model;

import java.util.List;

/**
 * Outcome of a settlement sweep.
 *
 * @param details    bets that reached a terminal state in this sweep
 * @param betReports per-bet diagnostics, only filled in force mode
 */
public record SettlementResult(int settled, int stillPending, List<Bet> details, List<BetReport> betReports) {
}
