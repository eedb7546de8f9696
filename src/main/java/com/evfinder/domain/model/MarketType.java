package com.evfinder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Market kinds the engine can price.
 * Anything the feeds cannot classify ends up as {@link #UNKNOWN} and is ignored by detection.
 */
public enum MarketType {
    H2H("h2h"),
    H2H_2WAY("h2h_2way"),
    OVER_UNDER("over_under"),
    BTTS("btts"),
    UNKNOWN("unknown");

    private final String key;

    MarketType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /** Head-to-head family: 1X2 and two-way moneyline markets are priced the same way. */
    public boolean isHeadToHead() {
        return this == H2H || this == H2H_2WAY;
    }

    /**
     * Resolves a wire key ("h2h", "over_under", ...). Unknown or blank keys map to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static MarketType fromKey(String key) {
        if (key == null || key.isBlank()) {
            return UNKNOWN;
        }
        String normalized = key.trim().toLowerCase();
        for (MarketType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Infers the type from a market key such as "over_under_2.5", "btts" or "h2h".
     * Keys that carry no recognisable prefix are treated as head-to-head.
     */
    public static MarketType fromMarketKey(String market) {
        if (market == null || market.isBlank()) {
            return H2H;
        }
        String normalized = market.trim().toLowerCase();
        if (normalized.startsWith(OVER_UNDER.key)) {
            return OVER_UNDER;
        }
        if (normalized.equals(BTTS.key)) {
            return BTTS;
        }
        if (normalized.equals(H2H_2WAY.key)) {
            return H2H_2WAY;
        }
        return H2H;
    }

    @Override
    public String toString() {
        return key;
    }
}
