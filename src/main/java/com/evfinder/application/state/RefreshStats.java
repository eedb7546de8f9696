package com.evfinder.application.state;

import java.util.Map;

/**
 * Figures from the last completed refresh.
 */
public record RefreshStats(
    int totalBets,
    int totalEvents,
    double avgEv,
    Map<String, Integer> bySport,
    String topSport
) {

    public static RefreshStats empty() {
        return new RefreshStats(0, 0, 0, Map.of(), "-");
    }
}
