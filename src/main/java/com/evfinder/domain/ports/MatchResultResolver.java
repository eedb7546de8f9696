package com.evfinder.domain.ports;

import com.evfinder.domain.model.MatchResult;

import java.time.Instant;

/**
 * Port for looking up how a match ended.
 */
@FunctionalInterface
public interface MatchResultResolver {

    /**
     * Resolves the result of a match.
     *
     * @param matchId   Target bookmaker match id
     * @param home      Home team as the bet recorded it
     * @param away      Away team as the bet recorded it
     * @param startTime Kick-off, may be null
     * @param sport     Sport label
     * @return The result, or null when the source has nothing yet
     * @throws Exception if the lookup fails
     */
    MatchResult resolve(String matchId, String home, String away, Instant startTime, String sport) throws Exception;
}
