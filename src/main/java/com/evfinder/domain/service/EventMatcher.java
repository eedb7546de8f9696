package com.evfinder.domain.service;

import com.evfinder.domain.model.MarketEvent;
import com.evfinder.domain.ports.StringSimilarity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs target events with reference events by team-name similarity.
 *
 * Matching is greedy in target order: each target takes the best unused reference
 * scoring at least the threshold, and that reference is then unavailable to later targets.
 * Callers pass lists from a single market family.
 */
public class EventMatcher {

    public static final double DEFAULT_THRESHOLD = 0.55;

    private final StringSimilarity similarity;
    private final double threshold;

    public EventMatcher(StringSimilarity similarity) {
        this(similarity, DEFAULT_THRESHOLD);
    }

    public EventMatcher(StringSimilarity similarity, double threshold) {
        this.similarity = similarity;
        this.threshold = threshold;
    }

    /**
     * Greedy one-to-one matching. Unmatched targets are left out of the result.
     */
    public <T extends MarketEvent, R extends MarketEvent> List<MatchedPair<T, R>> match(
            List<T> targets, List<R> references) {
        List<MatchedPair<T, R>> matched = new ArrayList<>();
        if (targets == null || references == null || targets.isEmpty() || references.isEmpty()) {
            return matched;
        }

        boolean[] used = new boolean[references.size()];
        for (T target : targets) {
            int bestIndex = -1;
            double bestScore = 0;

            for (int i = 0; i < references.size(); i++) {
                if (used[i]) {
                    continue;
                }
                double score = eventScore(target, references.get(i));
                if (score > bestScore && score >= threshold) {
                    bestScore = score;
                    bestIndex = i;
                }
            }

            if (bestIndex >= 0) {
                used[bestIndex] = true;
                matched.add(new MatchedPair<>(target, references.get(bestIndex), bestScore));
            }
        }
        return matched;
    }

    /**
     * Matches only events that share the same line, so an over/under 1.5 never pairs with a 2.5.
     * Groups are processed in the order their threshold first appears among the targets.
     */
    public <T extends MarketEvent, R extends MarketEvent> List<MatchedPair<T, R>> matchByThreshold(
            List<T> targets, List<R> references) {
        Map<Double, List<T>> targetsByThreshold = groupByThreshold(targets);
        Map<Double, List<R>> referencesByThreshold = groupByThreshold(references);

        List<MatchedPair<T, R>> matched = new ArrayList<>();
        for (Map.Entry<Double, List<T>> group : targetsByThreshold.entrySet()) {
            List<R> candidates = referencesByThreshold.get(group.getKey());
            if (candidates == null || candidates.isEmpty()) {
                continue;
            }
            matched.addAll(match(group.getValue(), candidates));
        }
        return matched;
    }

    /**
     * Score of a target/reference pair: mean of the two team similarities, taking the
     * better of the direct and the swapped (home/away reversed) orientation.
     */
    public double eventScore(MarketEvent target, MarketEvent reference) {
        double direct = (teamSimilarity(target.getHome(), reference.getHome())
            + teamSimilarity(target.getAway(), reference.getAway())) / 2;
        double swapped = (teamSimilarity(target.getHome(), reference.getAway())
            + teamSimilarity(target.getAway(), reference.getHome())) / 2;
        return Math.max(direct, swapped);
    }

    public double teamSimilarity(String a, String b) {
        return similarity.similarity(NormalizationUtils.normalizeName(a), NormalizationUtils.normalizeName(b));
    }

    private <E extends MarketEvent> Map<Double, List<E>> groupByThreshold(List<E> events) {
        Map<Double, List<E>> grouped = new LinkedHashMap<>();
        if (events == null) {
            return grouped;
        }
        for (E event : events) {
            grouped.computeIfAbsent(event.resolveThreshold(), key -> new ArrayList<>()).add(event);
        }
        return grouped;
    }
}
