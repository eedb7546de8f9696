package com.evfinder.application.usecase;

import java.time.Duration;

/**
 * @param minEvThreshold   Exclusive lower bound on EV for a value bet to be reported
 * @param referenceMarkets Market filter passed to the reference gateway ("h2h", "all", ...)
 * @param cacheDuration    Age after which the detected list is refreshed on read
 */
public record DetectionSettings(double minEvThreshold, String referenceMarkets, Duration cacheDuration) {

    public static DetectionSettings defaults() {
        return new DetectionSettings(0.0, "h2h", Duration.ofSeconds(120));
    }
}
