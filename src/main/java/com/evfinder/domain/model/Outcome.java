package com.evfinder.domain.model;

/**
 * One selection within a market, with its decimal odds.
 * Implied and fair probabilities are only populated on devigged copies.
 */
public class Outcome {

    /** Label as the source shows it, e.g. "PSG", "Draw", "Over 2.5", "Oui". */
    private String name;

    /** Decimal odds. */
    private double odds;

    /** 1 / odds. Null until devigged. */
    private Double impliedProb;

    /** Implied probability with the bookmaker margin removed. Null until devigged. */
    private Double fairProb;

    public Outcome() {
    }

    public Outcome(String name, double odds) {
        this.name = name;
        this.odds = odds;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getOdds() {
        return odds;
    }

    public void setOdds(double odds) {
        this.odds = odds;
    }

    public Double getImpliedProb() {
        return impliedProb;
    }

    public void setImpliedProb(Double impliedProb) {
        this.impliedProb = impliedProb;
    }

    public Double getFairProb() {
        return fairProb;
    }

    public void setFairProb(Double fairProb) {
        this.fairProb = fairProb;
    }

    @Override
    public String toString() {
        return name + "@" + odds;
    }
}
