package com.evfinder.domain.model;

/**
 * Human-readable diagnostic for one bet examined by a settlement sweep.
 *
 * @param reason short machine key: not_started, in_progress, error, no_result, won, lost, void
 */
public record BetReport(String betId, String match, String betOn, String reason, String message) {
}
