package com.evfinder.application.usecase;

import com.evfinder.domain.model.ValueBet;

import java.util.List;

/**
 * Listing filter; null or non-positive bounds are ignored.
 *
 * @param sport   Sport label, compared case-insensitively
 * @param minEv   Minimum EV percentage, inclusive
 * @param minOdds Minimum target odds, inclusive
 * @param maxOdds Maximum target odds, inclusive
 */
public record ValueBetFilter(String sport, Double minEv, Double minOdds, Double maxOdds) {

    public static ValueBetFilter none() {
        return new ValueBetFilter(null, null, null, null);
    }

    public List<ValueBet> apply(List<ValueBet> valueBets) {
        return valueBets.stream().filter(this::accepts).toList();
    }

    public boolean accepts(ValueBet valueBet) {
        if (sport != null && !sport.isBlank() && !sport.equalsIgnoreCase(valueBet.sport())) {
            return false;
        }
        if (minEv != null && minEv > 0 && valueBet.evPercent() < minEv) {
            return false;
        }
        if (minOdds != null && minOdds > 0 && valueBet.targetOdds() < minOdds) {
            return false;
        }
        return maxOdds == null || maxOdds <= 0 || valueBet.targetOdds() <= maxOdds;
    }
}
