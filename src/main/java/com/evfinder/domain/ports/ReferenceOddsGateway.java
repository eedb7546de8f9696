package com.evfinder.domain.ports;

import com.evfinder.domain.model.ReferenceEvent;

import java.util.List;

/**
 * Port for the sharp/consensus prices that fair probabilities are derived from.
 */
public interface ReferenceOddsGateway {

    /**
     * Fetches consensus markets for one sport.
     *
     * @param sportKey     Sport key as carried by target events (e.g., "soccer")
     * @param marketFilter "h2h", "over_under", "btts" or "all"
     * @return Reference events, not yet devigged
     * @throws Exception if the source is unavailable
     */
    List<ReferenceEvent> fetchReferenceEvents(String sportKey, String marketFilter) throws Exception;
}
