package com.evfinder.domain.ports;

import com.evfinder.domain.model.MarketEvent;

import java.util.List;

/**
 * Port for the bookmaker whose prices are checked for value.
 */
public interface TargetOddsGateway {

    /**
     * Gets the name of the provider behind this gateway.
     *
     * @return Provider name (e.g., "winamax")
     */
    String getProviderName();

    /**
     * Fetches the current markets of the target bookmaker, already normalized.
     *
     * @return List of market events, one per (match, market)
     * @throws Exception if the source is unavailable
     */
    List<MarketEvent> fetchTargetEvents() throws Exception;
}
