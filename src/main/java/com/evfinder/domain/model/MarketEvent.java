package com.evfinder.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A single market of a match as offered by one source (target bookmaker or reference feed).
 */
public class MarketEvent {

    /** Default line for over/under markets that arrive without one. */
    public static final double DEFAULT_TOTALS_THRESHOLD = 2.5;

    /** Source-side match identifier, used to settle and deduplicate bets. */
    private String matchId;

    /** Human-readable sport label, e.g. "Football". */
    private String sport;

    /** Sport key used to query reference feeds, e.g. "soccer". */
    private String sportKey;

    private String home;

    private String away;

    /** Market key such as "h2h", "over_under_2.5" or "btts". Derived when absent. */
    private String market;

    private MarketType marketType = MarketType.UNKNOWN;

    /** Goal line, only meaningful for over/under markets. */
    private Double threshold;

    private List<Outcome> outcomes = new ArrayList<>();

    /** Kick-off time. Null when the source does not publish it. */
    private Instant startTime;

    /** Provider name that produced this event. */
    private String source;

    /**
     * Market key for display and deduplication.
     * Falls back to a key built from the market type and threshold.
     */
    public String resolveMarketKey() {
        if (market != null && !market.isBlank()) {
            return market;
        }
        return switch (marketType) {
            case OVER_UNDER -> "over_under_" + resolveThreshold();
            case BTTS -> "btts";
            case H2H_2WAY -> "h2h_2way";
            default -> "h2h";
        };
    }

    /**
     * Declared market type, or the type implied by the market key when none was declared.
     */
    public MarketType resolveMarketType() {
        if (marketType == MarketType.UNKNOWN && market != null && !market.isBlank()) {
            return MarketType.fromMarketKey(market);
        }
        return marketType;
    }

    /**
     * Threshold used to partition totals markets. Over/under events without a line take it from
     * a market key such as "over_under_3.5", else {@link #DEFAULT_TOTALS_THRESHOLD}; other markets
     * keep whatever they carry (usually null).
     */
    public Double resolveThreshold() {
        if (threshold != null || resolveMarketType() != MarketType.OVER_UNDER) {
            return threshold;
        }
        Double fromKey = thresholdFromMarketKey(market);
        return fromKey != null ? fromKey : DEFAULT_TOTALS_THRESHOLD;
    }

    private static Double thresholdFromMarketKey(String market) {
        if (market == null) {
            return null;
        }
        String prefix = MarketType.OVER_UNDER.getKey() + "_";
        String normalized = market.trim().toLowerCase();
        if (!normalized.startsWith(prefix)) {
            return null;
        }
        try {
            return Double.valueOf(normalized.substring(prefix.length()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String getMatchId() {
        return matchId;
    }

    public void setMatchId(String matchId) {
        this.matchId = matchId;
    }

    public String getSport() {
        return sport;
    }

    public void setSport(String sport) {
        this.sport = sport;
    }

    public String getSportKey() {
        return sportKey;
    }

    public void setSportKey(String sportKey) {
        this.sportKey = sportKey;
    }

    public String getHome() {
        return home;
    }

    public void setHome(String home) {
        this.home = home;
    }

    public String getAway() {
        return away;
    }

    public void setAway(String away) {
        this.away = away;
    }

    public String getMarket() {
        return market;
    }

    public void setMarket(String market) {
        this.market = market;
    }

    public MarketType getMarketType() {
        return marketType;
    }

    public void setMarketType(MarketType marketType) {
        this.marketType = marketType == null ? MarketType.UNKNOWN : marketType;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public List<Outcome> getOutcomes() {
        return outcomes;
    }

    public void setOutcomes(List<Outcome> outcomes) {
        this.outcomes = outcomes == null ? new ArrayList<>() : outcomes;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    @Override
    public String toString() {
        return home + " vs " + away + " [" + resolveMarketKey() + "]";
    }
}
