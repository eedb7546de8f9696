package com.evfinder.domain.model;

import java.util.List;

/**
 * Outcome of one placement batch.
 *
 * @param details bets created by this batch, in candidate order
 */
public record PlacementResult(int placed, int skipped, List<Bet> details) {

    public static PlacementResult allSkipped(int candidates) {
        return new PlacementResult(0, candidates, List.of());
    }
}
