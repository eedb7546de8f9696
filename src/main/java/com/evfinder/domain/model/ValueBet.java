package com.evfinder.domain.model;

import java.time.Instant;

/**
 * A priced opportunity: target odds above the devigged consensus probability.
 *
 * @param fairProbPct    consensus probability in percent, one decimal
 * @param impliedProbPct probability implied by the target odds in percent, one decimal
 * @param evPercent      (fair probability * target odds - 1) * 100, two decimals
 */
public record ValueBet(
    String sport,
    String home,
    String away,
    String market,
    MarketType marketType,
    Double threshold,
    String betOn,
    double targetOdds,
    double fairProbPct,
    double impliedProbPct,
    double evPercent,
    String matchId,
    Instant startTime,
    int numBooks
) {

    /** Identity of an opportunity within one detection run. */
    public record DetectionKey(String home, String away, String betOn, String market) {
    }

    /** Identity of a selection on the ledger. */
    public record PlacementKey(String matchId, String betOn, String market) {
    }

    /** Key used to drop repeated opportunities before they leave the detector. */
    public DetectionKey detectionKey() {
        return new DetectionKey(home, away, betOn, market);
    }

    /** Key used by the ledger to refuse placing the same selection twice. */
    public PlacementKey placementKey() {
        return new PlacementKey(matchId, betOn, market);
    }
}
