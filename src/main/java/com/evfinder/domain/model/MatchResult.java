package com.evfinder.domain.model;

import java.util.List;

/**
 * Outcome of a match as returned by a result source.
 *
 * @param score           final score as published, e.g. "2-1"; may be blank
 * @param winningOutcomes labels that won the head-to-head market (team name or draw synonyms)
 */
public record MatchResult(
    ResultStatus status,
    String score,
    List<String> winningOutcomes,
    String home,
    String away
) {

    public MatchResult {
        score = score == null ? "" : score;
        winningOutcomes = winningOutcomes == null ? List.of() : List.copyOf(winningOutcomes);
    }

    public static MatchResult live(String home, String away) {
        return new MatchResult(ResultStatus.LIVE, "", List.of(), home, away);
    }

    public static MatchResult cancelled(String home, String away) {
        return new MatchResult(ResultStatus.CANCELLED, "", List.of(), home, away);
    }
}
