package com.evfinder.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A placed virtual bet. Created pending by the ledger, then moved once to won, lost or void.
 */
public class Bet {

    private String betId;
    private Instant placedAt;

    private String sport;
    private String home;
    private String away;
    private String market;
    private MarketType marketType;
    private Double threshold;
    private String betOn;
    private double targetOdds;
    private double fairProbPct;
    private double impliedProbPct;
    private double evPercent;
    private String matchId;
    private Instant startTime;
    private int numBooks;

    private BigDecimal stake;
    private double kellyFraction;
    private double kellyUsed;
    private BigDecimal potentialReturn;

    private BetStatus status = BetStatus.PENDING;
    private Instant settledAt;
    private BigDecimal profit;
    private String resultInfo;

    public Bet() {
    }

    /**
     * Builds a pending bet from a detected value bet and its Kelly sizing.
     */
    public static Bet pending(String betId, Instant placedAt, ValueBet valueBet, KellySizing sizing) {
        Bet bet = new Bet();
        bet.betId = betId;
        bet.placedAt = placedAt;
        bet.sport = valueBet.sport();
        bet.home = valueBet.home();
        bet.away = valueBet.away();
        bet.market = valueBet.market();
        bet.marketType = valueBet.marketType();
        bet.threshold = valueBet.threshold();
        bet.betOn = valueBet.betOn();
        bet.targetOdds = valueBet.targetOdds();
        bet.fairProbPct = valueBet.fairProbPct();
        bet.impliedProbPct = valueBet.impliedProbPct();
        bet.evPercent = valueBet.evPercent();
        bet.matchId = valueBet.matchId();
        bet.startTime = valueBet.startTime();
        bet.numBooks = valueBet.numBooks();
        bet.stake = sizing.stake();
        bet.kellyFraction = sizing.kellyFraction();
        bet.kellyUsed = sizing.kellyUsed();
        bet.potentialReturn = Money.payout(sizing.stake(), valueBet.targetOdds());
        bet.status = BetStatus.PENDING;
        return bet;
    }

    public ValueBet.PlacementKey placementKey() {
        return new ValueBet.PlacementKey(matchId, betOn, market);
    }

    public String matchLabel() {
        return home + " vs " + away;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == BetStatus.PENDING;
    }

    public String getBetId() {
        return betId;
    }

    public void setBetId(String betId) {
        this.betId = betId;
    }

    public Instant getPlacedAt() {
        return placedAt;
    }

    public void setPlacedAt(Instant placedAt) {
        this.placedAt = placedAt;
    }

    public String getSport() {
        return sport;
    }

    public void setSport(String sport) {
        this.sport = sport;
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
        this.marketType = marketType;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getBetOn() {
        return betOn;
    }

    public void setBetOn(String betOn) {
        this.betOn = betOn;
    }

    public double getTargetOdds() {
        return targetOdds;
    }

    public void setTargetOdds(double targetOdds) {
        this.targetOdds = targetOdds;
    }

    public double getFairProbPct() {
        return fairProbPct;
    }

    public void setFairProbPct(double fairProbPct) {
        this.fairProbPct = fairProbPct;
    }

    public double getImpliedProbPct() {
        return impliedProbPct;
    }

    public void setImpliedProbPct(double impliedProbPct) {
        this.impliedProbPct = impliedProbPct;
    }

    public double getEvPercent() {
        return evPercent;
    }

    public void setEvPercent(double evPercent) {
        this.evPercent = evPercent;
    }

    public String getMatchId() {
        return matchId;
    }

    public void setMatchId(String matchId) {
        this.matchId = matchId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public int getNumBooks() {
        return numBooks;
    }

    public void setNumBooks(int numBooks) {
        this.numBooks = numBooks;
    }

    public BigDecimal getStake() {
        return stake;
    }

    public void setStake(BigDecimal stake) {
        this.stake = stake;
    }

    public double getKellyFraction() {
        return kellyFraction;
    }

    public void setKellyFraction(double kellyFraction) {
        this.kellyFraction = kellyFraction;
    }

    public double getKellyUsed() {
        return kellyUsed;
    }

    public void setKellyUsed(double kellyUsed) {
        this.kellyUsed = kellyUsed;
    }

    public BigDecimal getPotentialReturn() {
        return potentialReturn;
    }

    public void setPotentialReturn(BigDecimal potentialReturn) {
        this.potentialReturn = potentialReturn;
    }

    public BetStatus getStatus() {
        return status;
    }

    public void setStatus(BetStatus status) {
        this.status = status;
    }

    public Instant getSettledAt() {
        return settledAt;
    }

    public void setSettledAt(Instant settledAt) {
        this.settledAt = settledAt;
    }

    public BigDecimal getProfit() {
        return profit;
    }

    public void setProfit(BigDecimal profit) {
        this.profit = profit;
    }

    public String getResultInfo() {
        return resultInfo;
    }

    public void setResultInfo(String resultInfo) {
        this.resultInfo = resultInfo;
    }
}
