package com.evfinder.domain.service;

import com.evfinder.domain.model.MarketEvent;
import com.evfinder.domain.model.MarketType;
import com.evfinder.domain.model.Outcome;
import com.evfinder.domain.model.ReferenceEvent;
import com.evfinder.domain.model.ValueBet;
import com.evfinder.domain.ports.StringSimilarity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds positive expected-value outcomes on the target bookmaker.
 *
 * Events are split by market family, matched against the reference events of the same family,
 * and each target outcome is priced against the devigged reference probability of the same
 * selection.
 */
public class ValueBetDetector {

    /** Anything at or above this EV is assumed to be a data error rather than an edge. */
    public static final double MAX_PLAUSIBLE_EV = 50.0;

    /** Minimum name similarity to pair a target outcome with a reference outcome. */
    public static final double DEFAULT_OUTCOME_THRESHOLD = 0.5;

    private final OddsNormalizer oddsNormalizer;
    private final EventMatcher eventMatcher;
    private final StringSimilarity similarity;
    private final MarketKeywords keywords;
    private final double outcomeThreshold;

    public ValueBetDetector(OddsNormalizer oddsNormalizer, EventMatcher eventMatcher,
                            StringSimilarity similarity, MarketKeywords keywords) {
        this(oddsNormalizer, eventMatcher, similarity, keywords, DEFAULT_OUTCOME_THRESHOLD);
    }

    public ValueBetDetector(OddsNormalizer oddsNormalizer, EventMatcher eventMatcher,
                            StringSimilarity similarity, MarketKeywords keywords, double outcomeThreshold) {
        this.oddsNormalizer = oddsNormalizer;
        this.eventMatcher = eventMatcher;
        this.similarity = similarity;
        this.keywords = keywords;
        this.outcomeThreshold = outcomeThreshold;
    }

    /**
     * Detects value bets across all market families.
     *
     * @param targets    Target bookmaker events
     * @param references Consensus events
     * @param minEv      Exclusive lower bound on the EV percentage
     * @return Value bets sorted by EV descending, one per (home, away, selection, market)
     */
    public List<ValueBet> detect(List<? extends MarketEvent> targets, List<ReferenceEvent> references, double minEv) {
        Map<MarketType, List<MarketEvent>> targetsByFamily = byFamily(targets);
        Map<MarketType, List<ReferenceEvent>> referencesByFamily = byFamily(references);

        List<ValueBet> valueBets = new ArrayList<>();

        List<MarketEvent> h2hTargets = targetsByFamily.getOrDefault(MarketType.H2H, List.of());
        List<ReferenceEvent> h2hReferences = referencesByFamily.getOrDefault(MarketType.H2H, List.of());
        if (!h2hTargets.isEmpty() && !h2hReferences.isEmpty()) {
            for (MatchedPair<MarketEvent, ReferenceEvent> pair : eventMatcher.match(h2hTargets, h2hReferences)) {
                valueBets.addAll(headToHead(pair, minEv));
            }
        }

        List<MarketEvent> totalsTargets = targetsByFamily.getOrDefault(MarketType.OVER_UNDER, List.of());
        List<ReferenceEvent> totalsReferences = referencesByFamily.getOrDefault(MarketType.OVER_UNDER, List.of());
        if (!totalsTargets.isEmpty() && !totalsReferences.isEmpty()) {
            for (MatchedPair<MarketEvent, ReferenceEvent> pair
                    : eventMatcher.matchByThreshold(totalsTargets, totalsReferences)) {
                valueBets.addAll(overUnder(pair, minEv));
            }
        }

        List<MarketEvent> bttsTargets = targetsByFamily.getOrDefault(MarketType.BTTS, List.of());
        List<ReferenceEvent> bttsReferences = referencesByFamily.getOrDefault(MarketType.BTTS, List.of());
        if (!bttsTargets.isEmpty() && !bttsReferences.isEmpty()) {
            for (MatchedPair<MarketEvent, ReferenceEvent> pair
                    : eventMatcher.matchByThreshold(bttsTargets, bttsReferences)) {
                valueBets.addAll(bothTeamsToScore(pair, minEv));
            }
        }

        valueBets.sort(Comparator.comparingDouble(ValueBet::evPercent).reversed());
        return deduplicate(valueBets);
    }

    /**
     * EV of a bet in percent, rounded half-up to 2 decimals.
     */
    public static double expectedValuePercent(double odds, double fairProbability) {
        double ev = (fairProbability * odds - 1) * 100;
        return BigDecimal.valueOf(ev).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Keeps the first value bet for each (home, away, selection, market); order is preserved.
     */
    public static List<ValueBet> deduplicate(List<ValueBet> valueBets) {
        Set<ValueBet.DetectionKey> seen = new HashSet<>();
        List<ValueBet> unique = new ArrayList<>();
        for (ValueBet valueBet : valueBets) {
            if (seen.add(valueBet.detectionKey())) {
                unique.add(valueBet);
            }
        }
        return unique;
    }

    private List<ValueBet> headToHead(MatchedPair<MarketEvent, ReferenceEvent> pair, double minEv) {
        Map<String, Double> fairByName = new LinkedHashMap<>();
        for (Outcome outcome : devigged(pair.reference())) {
            fairByName.put(NormalizationUtils.normalizeName(outcome.getName()), outcome.getFairProb());
        }
        if (fairByName.isEmpty()) {
            return List.of();
        }

        MarketEvent target = pair.target();
        String market = target.getMarket() == null || target.getMarket().isBlank() ? "h2h" : target.getMarket();

        List<ValueBet> found = new ArrayList<>();
        for (Outcome outcome : target.getOutcomes()) {
            Double fair = headToHeadProbability(outcome.getName(), fairByName);
            if (fair == null) {
                continue;
            }
            ValueBet valueBet = priced(pair, outcome, fair, market, MarketType.H2H, null, minEv);
            if (valueBet != null) {
                found.add(valueBet);
            }
        }
        return found;
    }

    private Double headToHeadProbability(String targetName, Map<String, Double> fairByName) {
        String normalized = NormalizationUtils.normalizeName(targetName);

        Double best = null;
        double bestSimilarity = 0;
        for (Map.Entry<String, Double> entry : fairByName.entrySet()) {
            double score = similarity.similarity(normalized, entry.getKey());
            if (score > bestSimilarity && score > outcomeThreshold) {
                bestSimilarity = score;
                best = entry.getValue();
            }
        }

        // "Match nul" rarely resembles "Draw"
        if (best == null && keywords.isDraw(normalized)) {
            for (Map.Entry<String, Double> entry : fairByName.entrySet()) {
                if (keywords.isDraw(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return best;
    }

    private List<ValueBet> overUnder(MatchedPair<MarketEvent, ReferenceEvent> pair, double minEv) {
        Map<MarketKeywords.TotalsSide, Double> fairBySide = new EnumMap<>(MarketKeywords.TotalsSide.class);
        for (Outcome outcome : devigged(pair.reference())) {
            MarketKeywords.TotalsSide side = keywords.totalsSide(outcome.getName());
            if (side != null) {
                fairBySide.put(side, outcome.getFairProb());
            }
        }

        Double threshold = pair.target().resolveThreshold();
        String market = "over_under_" + threshold;

        List<ValueBet> found = new ArrayList<>();
        for (Outcome outcome : pair.target().getOutcomes()) {
            MarketKeywords.TotalsSide side = keywords.totalsSide(outcome.getName());
            Double fair = side == null ? null : fairBySide.get(side);
            if (fair == null) {
                continue;
            }
            ValueBet valueBet = priced(pair, outcome, fair, market, MarketType.OVER_UNDER, threshold, minEv);
            if (valueBet != null) {
                found.add(valueBet);
            }
        }
        return found;
    }

    private List<ValueBet> bothTeamsToScore(MatchedPair<MarketEvent, ReferenceEvent> pair, double minEv) {
        Map<MarketKeywords.BttsSide, Double> fairBySide = new EnumMap<>(MarketKeywords.BttsSide.class);
        for (Outcome outcome : devigged(pair.reference())) {
            MarketKeywords.BttsSide side = keywords.bttsSide(outcome.getName());
            if (side != null) {
                fairBySide.put(side, outcome.getFairProb());
            }
        }

        List<ValueBet> found = new ArrayList<>();
        for (Outcome outcome : pair.target().getOutcomes()) {
            MarketKeywords.BttsSide side = keywords.bttsSide(outcome.getName());
            Double fair = side == null ? null : fairBySide.get(side);
            if (fair == null) {
                continue;
            }
            ValueBet valueBet = priced(pair, outcome, fair, "btts", MarketType.BTTS, null, minEv);
            if (valueBet != null) {
                found.add(valueBet);
            }
        }
        return found;
    }

    /**
     * Builds the value bet for one target outcome, or null when its EV is outside (minEv, 50).
     */
    private ValueBet priced(MatchedPair<MarketEvent, ReferenceEvent> pair, Outcome outcome, double fair,
                            String market, MarketType marketType, Double threshold, double minEv) {
        double odds = outcome.getOdds();
        double ev = expectedValuePercent(odds, fair);
        if (ev <= minEv || ev >= MAX_PLAUSIBLE_EV) {
            return null;
        }

        MarketEvent target = pair.target();
        ReferenceEvent reference = pair.reference();
        return new ValueBet(
            firstNonBlank(target.getSport(), reference.getSport(), "?"),
            firstNonBlank(target.getHome(), reference.getHome(), ""),
            firstNonBlank(target.getAway(), reference.getAway(), ""),
            market,
            marketType,
            threshold,
            outcome.getName(),
            odds,
            roundOneDecimal(fair * 100),
            roundOneDecimal(oddsNormalizer.impliedProbability(odds) * 100),
            ev,
            target.getMatchId(),
            target.getStartTime() != null ? target.getStartTime() : reference.getCommenceTime(),
            reference.getNumBooks()
        );
    }

    private List<Outcome> devigged(ReferenceEvent reference) {
        List<Outcome> outcomes = oddsNormalizer.devig(reference.getOutcomes());
        if (outcomes == null) {
            return List.of();
        }
        // devig hands the input back untouched when the market is unusable
        return outcomes.stream().filter(outcome -> outcome.getFairProb() != null).toList();
    }

    private static <E extends MarketEvent> Map<MarketType, List<E>> byFamily(List<? extends E> events) {
        Map<MarketType, List<E>> grouped = new EnumMap<>(MarketType.class);
        if (events == null) {
            return grouped;
        }
        for (E event : events) {
            MarketType family = family(event);
            if (family != MarketType.UNKNOWN) {
                grouped.computeIfAbsent(family, key -> new ArrayList<>()).add(event);
            }
        }
        return grouped;
    }

    /**
     * Market family of an event: its declared type, or the type implied by its market key.
     * Head-to-head variants share the {@link MarketType#H2H} family.
     */
    static MarketType family(MarketEvent event) {
        MarketType type = event.resolveMarketType();
        return type.isHeadToHead() ? MarketType.H2H : type;
    }

    private static double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }
}
