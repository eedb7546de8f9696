package com.evfinder.domain.service;

import com.evfinder.domain.model.MarketEvent;

/**
 * A target event and the reference event it was matched to.
 */
public record MatchedPair<T extends MarketEvent, R extends MarketEvent>(T target, R reference, double score) {
}
