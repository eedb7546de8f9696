package com.evfinder.domain.service;

import com.evfinder.domain.model.Outcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts decimal odds to probabilities and removes the bookmaker margin.
 */
public class OddsNormalizer {

    /**
     * @return 1 / odds, or 0 for non-positive odds
     */
    public double impliedProbability(double odds) {
        if (odds <= 0) {
            return 0;
        }
        return 1.0 / odds;
    }

    /**
     * Additive devigging: each implied probability is divided by their sum so the fair
     * probabilities of the outcome set add up to 1.
     *
     * @return copies of the outcomes with implied and fair probabilities set, or the input
     *         list itself when the implied probabilities sum to 0 (unusable market)
     */
    public List<Outcome> devig(List<Outcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return outcomes;
        }

        double total = 0;
        double[] implied = new double[outcomes.size()];
        for (int i = 0; i < outcomes.size(); i++) {
            implied[i] = impliedProbability(outcomes.get(i).getOdds());
            total += implied[i];
        }

        if (total == 0) {
            return outcomes;
        }

        List<Outcome> devigged = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            Outcome source = outcomes.get(i);
            Outcome copy = new Outcome(source.getName(), source.getOdds());
            copy.setImpliedProb(implied[i]);
            copy.setFairProb(implied[i] / total);
            devigged.add(copy);
        }
        return devigged;
    }

    /**
     * Sum of implied probabilities, i.e. 1 + bookmaker margin.
     */
    public double overround(List<Outcome> outcomes) {
        double total = 0;
        for (Outcome outcome : outcomes) {
            total += impliedProbability(outcome.getOdds());
        }
        return total;
    }
}
