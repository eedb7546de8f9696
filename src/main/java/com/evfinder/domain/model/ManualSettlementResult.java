package com.evfinder.domain.model;

/**
 * Response to a manual settlement request. {@code summary} is null when the request was refused.
 */
public record ManualSettlementResult(boolean success, String message, BankrollSummary summary) {

    public static ManualSettlementResult refused(String message) {
        return new ManualSettlementResult(false, message, null);
    }
}
