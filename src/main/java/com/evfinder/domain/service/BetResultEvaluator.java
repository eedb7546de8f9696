package com.evfinder.domain.service;

import com.evfinder.domain.model.Bet;
import com.evfinder.domain.model.MarketType;
import com.evfinder.domain.model.MatchResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a bet won from a finished match result.
 */
public class BetResultEvaluator {

    public enum Determination { WON, LOST, INDETERMINATE }

    /** Goals of the home and away side, as written in the score. */
    public record Score(int home, int away) {

        public int total() {
            return home + away;
        }
    }

    private static final Pattern SCORE_PATTERN = Pattern.compile("(\\d+)\\s*[-:\\s]\\s*(\\d+)");

    private final MarketKeywords keywords;

    public BetResultEvaluator(MarketKeywords keywords) {
        this.keywords = keywords;
    }

    /**
     * Evaluates a bet against a finished result.
     *
     * @return WON or LOST, or INDETERMINATE when the result does not carry enough information
     *         (unreadable score, unknown selection side, no winning outcomes)
     */
    public Determination evaluate(Bet bet, MatchResult result) {
        MarketType marketType = bet.getMarketType() == null ? MarketType.H2H : bet.getMarketType();

        if (marketType.isHeadToHead()) {
            if (result.winningOutcomes().isEmpty()) {
                return Determination.INDETERMINATE;
            }
            return of(isWinningOutcome(bet.getBetOn(), result));
        }

        Score score = parseScore(result.score());
        if (score == null) {
            return Determination.INDETERMINATE;
        }

        switch (marketType) {
            case OVER_UNDER -> {
                MarketKeywords.TotalsSide side = keywords.totalsSide(bet.getBetOn());
                Double threshold = bet.getThreshold();
                if (side == null || threshold == null) {
                    return Determination.INDETERMINATE;
                }
                return side == MarketKeywords.TotalsSide.OVER
                    ? of(score.total() > threshold)
                    : of(score.total() <= threshold);
            }
            case BTTS -> {
                MarketKeywords.BttsSide side = keywords.bttsSide(bet.getBetOn());
                if (side == null) {
                    return Determination.INDETERMINATE;
                }
                boolean bothScored = score.home() > 0 && score.away() > 0;
                return of(bothScored == (side == MarketKeywords.BttsSide.YES));
            }
            default -> {
                return Determination.INDETERMINATE;
            }
        }
    }

    /**
     * Parses scores written as "2-1", "2:1", "2 - 1" or "2 1".
     *
     * @return the score, or null when no pair of numbers can be read
     */
    public static Score parseScore(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = SCORE_PATTERN.matcher(text.trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return new Score(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean isWinningOutcome(String betOn, MatchResult result) {
        String selection = NormalizationUtils.normalizeName(betOn);
        for (String winner : result.winningOutcomes()) {
            if (NormalizationUtils.normalizeName(winner).equals(selection)) {
                return true;
            }
        }
        if (keywords.isDraw(selection)) {
            for (String winner : result.winningOutcomes()) {
                if (keywords.isDraw(winner)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Determination of(boolean won) {
        return won ? Determination.WON : Determination.LOST;
    }
}
