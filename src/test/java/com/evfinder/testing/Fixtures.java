package com.evfinder.testing;

import com.evfinder.domain.model.Bet;
import com.evfinder.domain.model.KellySizing;
import com.evfinder.domain.model.MarketEvent;
import com.evfinder.domain.model.MarketType;
import com.evfinder.domain.model.Money;
import com.evfinder.domain.model.Outcome;
import com.evfinder.domain.model.ReferenceEvent;
import com.evfinder.domain.model.ValueBet;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders shared by the tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-03-14T18:00:00Z");

    private Fixtures() {
    }

    public static MarketEvent target(String matchId, String home, String away, MarketType type, Double threshold,
                                     Object... outcomes) {
        MarketEvent event = new MarketEvent();
        fill(event, matchId, home, away, type, threshold, outcomes);
        event.setSource("winamax");
        return event;
    }

    public static ReferenceEvent reference(String home, String away, MarketType type, Double threshold, int numBooks,
                                           Object... outcomes) {
        ReferenceEvent event = new ReferenceEvent();
        fill(event, null, home, away, type, threshold, outcomes);
        event.setNumBooks(numBooks);
        event.setSource("consensus");
        return event;
    }

    /**
     * Outcomes are given as alternating name and odds: "Arsenal", 2.0, "Draw", 3.4, ...
     */
    public static List<Outcome> outcomes(Object... pairs) {
        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < pairs.length; i += 2) {
            outcomes.add(new Outcome((String) pairs[i], ((Number) pairs[i + 1]).doubleValue()));
        }
        return outcomes;
    }

    public static ValueBet valueBet(String matchId, String betOn, double odds, double fairProbPct, double evPercent,
                                    int numBooks) {
        return new ValueBet("Football", "Arsenal", "Chelsea", "h2h", MarketType.H2H, null, betOn, odds,
            fairProbPct, Math.round(1000.0 / odds) / 10.0, evPercent, matchId, NOW.plusSeconds(3600), numBooks);
    }

    public static ValueBet valueBet(String matchId, String betOn, double odds, double fairProbPct, double evPercent) {
        return valueBet(matchId, betOn, odds, fairProbPct, evPercent, 5);
    }

    public static Bet pendingBet(String betId, String stake, double odds, Instant startTime) {
        ValueBet valueBet = valueBet("m-" + betId, "Arsenal", odds, 60.0, 20.0);
        Bet bet = Bet.pending(betId, NOW.minusSeconds(86_400), valueBet,
            new KellySizing(0.2, 0.05, Money.round(new BigDecimal(stake)), 0.25));
        bet.setStartTime(startTime);
        return bet;
    }

    private static void fill(MarketEvent event, String matchId, String home, String away, MarketType type,
                             Double threshold, Object... outcomes) {
        event.setMatchId(matchId);
        event.setSport("Football");
        event.setSportKey("soccer");
        event.setHome(home);
        event.setAway(away);
        event.setMarketType(type);
        event.setThreshold(threshold);
        event.setOutcomes(outcomes(outcomes));
        event.setStartTime(NOW.plusSeconds(7200));
    }
}
