package com.evfinder.application.usecase;

import java.time.Duration;

/**
 * @param inProgressWindow Time after kick-off during which a match is assumed to be still running
 */
public record SettlementSettings(Duration inProgressWindow) {

    public static SettlementSettings defaults() {
        return new SettlementSettings(Duration.ofHours(2));
    }
}
